package uk.gegc.linguapath.features.activity.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "linguapath.activity")
public class ActivityProperties {

    /**
     * Accuracy at or above which a graded attempt counts as correct.
     */
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private double correctThreshold = 50.0;
}
