package com.flagship.finance_automation.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw binding of the {@code finance.*} configuration tree.
 *
 * This class is mutable so Spring Boot can bind it. Components never inject it
 * directly; {@link FinanceConfigurationFactory} validates it and turns it into
 * the immutable {@link FinanceConfiguration}.
 *
 * Map keys (bank names, group names, pot names) should use kebab-case in YAML,
 * e.g. {@code starling-joint} or {@code credit-cards}. Spring Boot drops
 * underscores from unbracketed map keys.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "finance")
public class FinanceProperties {

    @NotBlank
    private String zone = "Europe/London";

    @NotBlank
    private String currency = "GBP";

    @Valid
    private Polling polling = new Polling();

    @Valid
    private Map<String, Bank> banks = new LinkedHashMap<>();

    @Valid
    private Map<String, PotDefinition> pots = new LinkedHashMap<>();

    @Valid
    private Reconciliation reconciliation = new Reconciliation();

    @Valid
    private Transfers transfers = new Transfers();

    @Valid
    private AutoSaver autoSaver = new AutoSaver();

    @Valid
    private TrueLayer truelayer = new TrueLayer();

    @Valid
    private Monzo monzo = new Monzo();

    @Valid
    private HomeAssistant homeAssistant = new HomeAssistant();

    @Data
    public static class Polling {
        private boolean enabled = true;
        @NotNull
        private Duration interval = Duration.ofMinutes(15);
        @NotNull
        private Duration fetchTimeout = Duration.ofSeconds(30);
        @Min(1)
        private int fetchThreads = 4;
        @Min(1)
        private int pollThreads = 2;
    }

    @Data
    public static class Bank {
        private String accessToken;
        /**
         * Group name to member identifiers.
         */
        @Valid
        private Map<String, Group> groups = new LinkedHashMap<>();
    }

    @Data
    public static class Group {
        private List<String> accountIds = new ArrayList<>();
        private List<String> cardIds = new ArrayList<>();
    }

    @Data
    public static class PotDefinition {
        private String potId;
        private String purpose;
        private String fundingAccountId;
        /**
         * Group whose balance is the pot itself, as {@code BANK/group}.
         */
        private String balanceGroup;
        /**
         * Group whose balance the pot should match. Blank means no automatic target.
         */
        private String targetGroup;
        /**
         * Group holding the funding account balance, used to cap top-ups.
         */
        private String fundingGroup;
        private long minimumDelta = 500;
        private long minimumRemainder = 0;
        private long maximumAutoTopUp = 20_000;
        private boolean withdrawalsEnabled = true;
    }

    @Data
    public static class Reconciliation {
        private boolean enabled = true;
        @NotBlank
        private String cron = "0 0 21 * * *";
        @NotNull
        private Duration freshnessGrace = Duration.ofMinutes(2);
    }

    @Data
    public static class Transfers {
        @Min(1)
        private int maxAttempts = 5;
        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(1);
        @DecimalMin(value = "1.0", inclusive = false)
        private double multiplier = 2.0;
        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(30);
        private long maximumAmount = 1_000_000;
        private boolean recoveryEnabled = true;
        @NotNull
        private Duration recoveryInterval = Duration.ofMinutes(5);
        @NotNull
        private Duration staleReservationAfter = Duration.ofMinutes(10);
    }

    @Data
    public static class AutoSaver {
        private boolean enabled = false;
        /**
         * Name of the configured pot that receives the savings.
         */
        private String pot;
        private long amountPerTrack = 79;
        @NotNull
        private Duration debounceWindow = Duration.ofDays(1);
        /**
         * Start of the daily active window, {@code HH:mm}. Equal bounds mean always active.
         */
        @NotBlank
        private String activeFrom = "00:00";
        @NotBlank
        private String activeUntil = "00:00";
        @NotBlank
        private String topic = "media.track-changed";
        private Kafka kafka = new Kafka();
        @Valid
        private Sweep sweep = new Sweep();

        @Data
        public static class Kafka {
            private boolean enabled = true;
        }

        /**
         * Periodic saving computed from recent transactions, deposited on request.
         */
        @Data
        public static class Sweep {
            private boolean enabled = false;
            /**
             * Receiving pot; blank means the auto-saver pot.
             */
            private String pot;
            /**
             * Groups whose transactions count, as {@code BANK/group}.
             */
            private List<String> transactionGroups = new ArrayList<>();
            private boolean roundUps = true;
            /**
             * Percent of every debit, e.g. {@code 1.5}.
             */
            @DecimalMin("0")
            private BigDecimal debitPercentage = BigDecimal.ZERO;
            /**
             * Case-insensitive regular expression matched against debit descriptions.
             */
            private String naughtyPattern = "";
            @DecimalMin("0")
            private BigDecimal naughtyPercentage = BigDecimal.ZERO;
            private long minimum = 0;
            /**
             * How far back the first sweep looks when no sweep has committed yet.
             */
            @NotNull
            private Duration initialLookback = Duration.ofDays(7);
            @NotBlank
            private String entityId = "var.auto_save_amount";
            private boolean publishEnabled = true;
            @NotNull
            private Duration publishInterval = Duration.ofMinutes(30);
        }
    }

    @Data
    public static class TrueLayer {
        @NotBlank
        private String baseUrl = "https://api.truelayer.com";
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(2);
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(20);
    }

    @Data
    public static class Monzo {
        @NotBlank
        private String baseUrl = "https://api.monzo.com";
        private String accessToken;
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(20);
    }

    @Data
    public static class HomeAssistant {
        /**
         * Blank disables outbound calls; state and notifications are only logged.
         */
        private String baseUrl = "";
        private String token;
        @NotBlank
        private String notifyScript = "script.notify";
        @Min(1)
        private int publishThreads = 2;
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(10);
    }
}
