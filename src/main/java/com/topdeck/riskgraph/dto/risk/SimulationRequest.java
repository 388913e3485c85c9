package com.topdeck.riskgraph.dto.risk;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SimulationRequest {

    @NotBlank(message = "resourceId is required")
    private String resourceId;

    @NotNull(message = "failureType is required")
    private FailureScenario.FailureType failureType;
}
