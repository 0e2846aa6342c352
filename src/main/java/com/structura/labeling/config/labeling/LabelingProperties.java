package com.structura.labeling.config.labeling;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for mode selection, hybrid triggers and label acceptance.
 *
 * <p>The mode is kept as text so that an unrecognized name degrades to rule mode with a warning
 * instead of failing startup.
 */
@Validated
@ConfigurationProperties(prefix = "structura.labeling")
public class LabelingProperties {

    /** rule, remote (alias llm) or hybrid. */
    @NotBlank
    private final String mode;

    /** h2/h3 headings longer than this many characters are reviewed. */
    @Positive
    private final int headingLengthThreshold;

    /** Body paragraphs of at most this many characters count as short. */
    @Positive
    private final int shortBodyThreshold;

    /** Consecutive short bodies needed to suspect a list. */
    @Min(2)
    private final int shortBodyRunLength;

    /** Minimum remote confidence for a hybrid label to replace the rule label (0..1). */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double confidenceThreshold;

    /** Short bodies with a rule confidence below this value may form a suspected list (0..1). */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double listConfidenceThreshold;

    @ConstructorBinding
    public LabelingProperties(String mode, Integer headingLengthThreshold, Integer shortBodyThreshold,
                              Integer shortBodyRunLength, Double confidenceThreshold,
                              Double listConfidenceThreshold) {
        this.mode = mode == null || mode.isBlank() ? "hybrid" : mode.trim();

        int heading = headingLengthThreshold == null ? 30 : headingLengthThreshold;
        if (heading < 1) {
            throw new IllegalArgumentException("structura.labeling.heading-length-threshold must be positive");
        }
        this.headingLengthThreshold = heading;

        int shortBody = shortBodyThreshold == null ? 60 : shortBodyThreshold;
        if (shortBody < 1) {
            throw new IllegalArgumentException("structura.labeling.short-body-threshold must be positive");
        }
        this.shortBodyThreshold = shortBody;

        int run = shortBodyRunLength == null ? 3 : shortBodyRunLength;
        if (run < 2) {
            throw new IllegalArgumentException("structura.labeling.short-body-run-length must be >= 2");
        }
        this.shortBodyRunLength = run;

        double ct = confidenceThreshold == null ? 0.7 : confidenceThreshold;
        if (ct < 0.0 || ct > 1.0) {
            throw new IllegalArgumentException("structura.labeling.confidence-threshold must be in [0,1]");
        }
        this.confidenceThreshold = ct;

        double lct = listConfidenceThreshold == null ? 0.7 : listConfidenceThreshold;
        if (lct < 0.0 || lct > 1.0) {
            throw new IllegalArgumentException("structura.labeling.list-confidence-threshold must be in [0,1]");
        }
        this.listConfidenceThreshold = lct;
    }

    public String getMode() {
        return mode;
    }

    public int getHeadingLengthThreshold() {
        return headingLengthThreshold;
    }

    public int getShortBodyThreshold() {
        return shortBodyThreshold;
    }

    public int getShortBodyRunLength() {
        return shortBodyRunLength;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public double getListConfidenceThreshold() {
        return listConfidenceThreshold;
    }
}
