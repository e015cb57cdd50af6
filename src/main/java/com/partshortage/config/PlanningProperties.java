package com.partshortage.config;

import com.partshortage.domain.PlanningParameters;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "planning")
public class PlanningProperties {

    /** Calendar days after the planning date covered by the demand table. */
    @Min(0)
    private int horizonDays = 60;

    /** Workdays between order placement and the shortage date. */
    @Min(0)
    private int leadWorkdays = 5;

    /** Manufacturing orders with a status below this value are open. */
    @Min(1)
    private int orderStatusOpenThreshold = 6;

    @NotBlank
    private String terminalStepCode = "050";

    @NotBlank
    private String terminalStepTag = "PAINT";

    public PlanningParameters toParameters() {
        return new PlanningParameters(horizonDays, leadWorkdays, orderStatusOpenThreshold,
            terminalStepCode, terminalStepTag);
    }
}
