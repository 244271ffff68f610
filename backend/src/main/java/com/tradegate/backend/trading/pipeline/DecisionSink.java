package com.tradegate.backend.trading.pipeline;

import com.tradegate.backend.model.PipelineOutcome;

/**
 * Execution and accounting hand-off. Receives approved outcomes only.
 */
public interface DecisionSink {
    void accept(String portfolioId, PipelineOutcome outcome, double allocation);
}
