package com.flagship.finance_automation.autosave;

import com.flagship.finance_automation.config.FinanceConfiguration;
import com.flagship.finance_automation.observability.FinanceMetrics;
import com.flagship.finance_automation.pot.Pot;
import com.flagship.finance_automation.transfer.TransferEndpoint;
import com.flagship.finance_automation.transfer.TransferIntent;
import com.flagship.finance_automation.transfer.TransferLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalTime;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Turns a track-changed event into a fixed-amount save into the configured pot.
 *
 * The key {@code auto-save:<potId>:<trackId>:<bucket>} buckets the event time
 * by the debounce window, so redeliveries and repeats of the same track inside
 * one window share one ledger record. Two plays straddling a bucket boundary
 * land in different buckets and both save. Track ids longer than
 * {@value #MAX_TRACK_ID_IN_KEY} characters are replaced by their SHA-256 so the
 * key always fits the ledger.
 */
@Component
@Slf4j
public class AutoSaver {

    static final int MAX_TRACK_ID_IN_KEY = 64;

    private final FinanceConfiguration configuration;
    private final TransferLedger ledger;
    private final FinanceMetrics metrics;
    private final Clock clock;

    public AutoSaver(FinanceConfiguration configuration, TransferLedger ledger, FinanceMetrics metrics, Clock clock) {
        this.configuration = configuration;
        this.ledger = ledger;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Optional<TransferIntent> onTrigger(TrackChangedEvent event) {
        FinanceConfiguration.AutoSave autoSave = configuration.getAutoSave();
        if (!autoSave.isEnabled()) {
            log.debug("Auto-save disabled, ignoring event {}", event.getEventId());
            metrics.recordAutoSaveTrigger("disabled");
            return Optional.empty();
        }
        if (event.getTrackId() == null || event.getTrackId().isBlank() || event.getOccurredAt() == null) {
            log.warn("Ignoring track event {} without track id or time", event.getEventId());
            metrics.recordAutoSaveTrigger("invalid");
            return Optional.empty();
        }

        LocalTime localTime = event.getOccurredAt().atZone(configuration.getZone()).toLocalTime();
        if (!isActive(localTime, autoSave.getActiveFrom(), autoSave.getActiveUntil())) {
            log.debug("Track event {} at {} outside the active window {}-{}",
                    event.getEventId(), localTime, autoSave.getActiveFrom(), autoSave.getActiveUntil());
            metrics.recordAutoSaveTrigger("outside_window");
            return Optional.empty();
        }

        Pot pot = autoSave.getPot();
        String key = key(pot, event, autoSave);
        if (ledger.isCommitted(key)) {
            log.info("Track {} already saved in this window: key={}", event.getTrackId(), key);
            metrics.recordAutoSaveTrigger("already_saved");
            return Optional.empty();
        }

        metrics.recordAutoSaveTrigger("intent");
        return Optional.of(TransferIntent.create(key,
                TransferEndpoint.account(pot.getFundingAccountId()),
                TransferEndpoint.pot(pot.getPotId()),
                autoSave.getAmountPerTrack(),
                reason(event),
                clock.instant()));
    }

    static String key(Pot pot, TrackChangedEvent event, FinanceConfiguration.AutoSave autoSave) {
        long bucket = Math.floorDiv(event.getOccurredAt().toEpochMilli(), autoSave.getDebounceWindow().toMillis());
        return String.format("auto-save:%s:%s:%d", pot.getPotId(), trackIdForKey(event.getTrackId().trim()), bucket);
    }

    static String trackIdForKey(String trackId) {
        if (trackId.length() <= MAX_TRACK_ID_IN_KEY) {
            return trackId;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return "sha256-" + HexFormat.of().formatHex(digest.digest(trackId.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String reason(TrackChangedEvent event) {
        String track = event.getTrackName() == null || event.getTrackName().isBlank()
                ? event.getTrackId().trim() : event.getTrackName().trim();
        if (event.getArtist() == null || event.getArtist().isBlank()) {
            return "Auto-save for " + track;
        }
        return String.format("Auto-save for %s by %s", track, event.getArtist().trim());
    }

    /**
     * Half-open {@code [from, until)}. Equal bounds mean always active; from after
     * until wraps past midnight.
     */
    static boolean isActive(LocalTime time, LocalTime from, LocalTime until) {
        if (from.equals(until)) {
            return true;
        }
        if (from.isBefore(until)) {
            return !time.isBefore(from) && time.isBefore(until);
        }
        return !time.isBefore(from) || time.isBefore(until);
    }
}
