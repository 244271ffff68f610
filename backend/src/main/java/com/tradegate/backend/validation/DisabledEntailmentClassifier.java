package com.tradegate.backend.validation;

/**
 * Stand-in used when no NLI endpoint is configured.
 */
public class DisabledEntailmentClassifier implements EntailmentClassifier {

    @Override
    public EntailmentResponse classify(String premise, String hypothesis) {
        return EntailmentResponse.unavailable("classifier disabled");
    }
}
