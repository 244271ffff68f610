package com.tradegate.backend.schema;

import com.tradegate.backend.model.Claim;
import com.tradegate.backend.model.TradeAction;

import java.util.List;
import java.util.OptionalDouble;

public record ParsedAgentOutput(
        TradeAction action,
        double confidence,
        List<Claim> keyClaims,
        Double riskFraction,
        String reasoning
) {

    public ParsedAgentOutput {
        keyClaims = List.copyOf(keyClaims);
    }

    public OptionalDouble requestedRisk() {
        return riskFraction == null ? OptionalDouble.empty() : OptionalDouble.of(riskFraction);
    }
}
