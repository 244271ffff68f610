package com.tradegate.backend.schema;

import com.tradegate.backend.model.RegimeClassification;

import java.time.LocalDate;
import java.util.List;

/**
 * What the agent is asked to produce. On a retry it also carries the rejected text and
 * the validation errors that rejected it.
 */
public record GenerationRequest(
        String assetId,
        LocalDate date,
        RegimeClassification regime,
        int attempt,
        String previousOutput,
        List<String> validationErrors
) {

    public GenerationRequest {
        validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
    }

    public static GenerationRequest initial(String assetId, LocalDate date, RegimeClassification regime) {
        return new GenerationRequest(assetId, date, regime, 0, null, List.of());
    }

    public GenerationRequest retry(String rejectedOutput, List<String> errors) {
        return new GenerationRequest(assetId, date, regime, attempt + 1, rejectedOutput, errors);
    }

    public boolean isRetry() {
        return attempt > 0;
    }

    /**
     * Correction note for a regeneration, empty on the first attempt.
     */
    public String feedback() {
        if (!isRetry()) {
            return "";
        }
        return "Your previous response failed validation: " + String.join("; ", validationErrors)
                + ". Respond with a single JSON object with fields action (BUY, SELL or HOLD), "
                + "confidence (0 to 1) and key_claims (1 to 5 short factual statements), and nothing else.";
    }
}
