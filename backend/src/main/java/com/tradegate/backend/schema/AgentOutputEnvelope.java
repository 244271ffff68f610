package com.tradegate.backend.schema;

import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * Latest agent output as seen by the schema gate. Only the gate's retry loop mutates it:
 * the retry counter increments and everything else is replaced on each regeneration.
 */
@Getter
public class AgentOutputEnvelope {

    private String rawText;
    private ParsedAgentOutput parsed;
    private boolean schemaValid;
    private int retryCount;
    private List<String> errors = List.of();

    void replace(String rawText, ParsedAgentOutput parsed, List<String> errors) {
        this.rawText = rawText;
        this.parsed = parsed;
        this.schemaValid = parsed != null;
        this.errors = List.copyOf(errors);
    }

    void incrementRetry() {
        retryCount++;
    }

    public Optional<ParsedAgentOutput> parsedOutput() {
        return Optional.ofNullable(parsed);
    }
}
