package com.tradegate.backend.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradegate.backend.model.TradeAction;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Field contract for the generating agent's structured output.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentDecisionPayload {

    @NotNull
    private TradeAction action;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double confidence;

    @NotNull
    @Size(min = 1)
    @JsonProperty("key_claims")
    private List<@NotBlank String> keyClaims;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @JsonProperty("risk_fraction")
    private Double riskFraction;

    private String reasoning;
}
