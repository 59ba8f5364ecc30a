package com.flagship.finance_automation.autosave;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A "track changed" signal from the media player. Delivered at least once.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrackChangedEvent {

    @NotBlank(message = "Event id is required")
    @Size(max = 100, message = "Event id must be at most 100 characters")
    @JsonProperty("event_id")
    private String eventId;

    @NotBlank(message = "Track id is required")
    @Size(max = 200, message = "Track id must be at most 200 characters")
    @JsonProperty("track_id")
    private String trackId;

    @Size(max = 200, message = "Track name must be at most 200 characters")
    @JsonProperty("track_name")
    private String trackName;

    @Size(max = 200, message = "Artist must be at most 200 characters")
    @JsonProperty("artist")
    private String artist;

    @NotNull(message = "Occurrence time is required")
    @JsonProperty("occurred_at")
    private Instant occurredAt;
}
