package uk.gegc.linguapath.features.repetition.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import uk.gegc.linguapath.features.repetition.domain.model.IntervalBand;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Type-safe configuration for review scheduling.
 */
@Component
@Data
@Validated
@ConfigurationProperties(prefix = "linguapath.repetition")
public class RepetitionProperties {

    /**
     * Six intervals per band, indexed by mastery level 0-5,
     * e.g. {@code linguapath.repetition.intervals.short=1h,4h,8h,12h,18h,1d}.
     */
    @NotNull
    private Map<IntervalBand, List<Duration>> intervals = new LinkedHashMap<>();

    /**
     * Queue length used when a due-queue request does not give a limit.
     */
    @Min(1)
    private int defaultQueueLimit = 20;
}
