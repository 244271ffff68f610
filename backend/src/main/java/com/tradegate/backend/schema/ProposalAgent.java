package com.tradegate.backend.schema;

/**
 * The external model that writes a trade proposal as text. Thrown exceptions count as a
 * failed attempt.
 */
@FunctionalInterface
public interface ProposalAgent {
    String generate(GenerationRequest request);
}
