package com.ops.alertdecision.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

/**
 * Flapping and self-resolution verdicts for one pattern, computed together.
 */
@Value
public class PatternCheck {

    FlappingResult flapping;
    SelfResolutionResult selfResolution;

    /**
     * True when either pattern detector would suppress on its own.
     */
    @JsonIgnore
    public boolean isSuppressionSignal() {
        return flapping.isFlapping() || selfResolution.isSelfResolving();
    }
}
