package uk.gegc.linguapath.features.activity.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

/**
 * Inclusive time window. A null bound leaves that side open.
 */
@Schema(name = "AggregationWindow", description = "Inclusive time window; a missing bound is open")
public record AggregationWindow(
        @Schema(description = "Window start (inclusive)", nullable = true)
        Instant from,
        @Schema(description = "Window end (inclusive)", nullable = true)
        Instant to
) {

    public static AggregationWindow unbounded() {
        return new AggregationWindow(null, null);
    }

    public static AggregationWindow between(Instant from, Instant to) {
        return new AggregationWindow(from, to);
    }

    @JsonIgnore
    public boolean isInverted() {
        return from != null && to != null && from.isAfter(to);
    }

    public boolean contains(Instant instant) {
        if (instant == null) return false;
        if (from != null && instant.isBefore(from)) return false;
        return to == null || !instant.isAfter(to);
    }
}
