package com.partshortage.domain;

/**
 * Explicit run configuration handed to the engine entry point.
 */
public record PlanningParameters(
    int horizonDays,
    int leadWorkdays,
    int orderStatusOpenThreshold,
    String terminalStepCode,
    String terminalStepTag
) {

    public PlanningParameters withOverrides(Integer horizon, Integer lead, Integer threshold) {
        return new PlanningParameters(
            horizon != null ? horizon : horizonDays,
            lead != null ? lead : leadWorkdays,
            threshold != null ? threshold : orderStatusOpenThreshold,
            terminalStepCode,
            terminalStepTag);
    }
}
