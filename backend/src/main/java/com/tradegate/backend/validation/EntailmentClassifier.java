package com.tradegate.backend.validation;

/**
 * Natural-language-inference model behind a synchronous request/response boundary.
 * Implementations report failure through {@link EntailmentResponse} variants; any
 * exception they still throw is treated as the model being unavailable.
 */
public interface EntailmentClassifier {
    EntailmentResponse classify(String premise, String hypothesis);
}
