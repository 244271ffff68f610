package com.tradegate.backend.validation;

import com.tradegate.backend.model.Verdict;

public record EntailmentResponse(
        Status status,
        Verdict label,
        double confidence,
        String detail
) {

    public enum Status {
        OK,
        UNAVAILABLE,
        TIMEOUT
    }

    public static EntailmentResponse ok(Verdict label, double confidence) {
        return new EntailmentResponse(Status.OK, label, confidence, null);
    }

    public static EntailmentResponse unavailable(String detail) {
        return new EntailmentResponse(Status.UNAVAILABLE, null, 0.0, detail);
    }

    public static EntailmentResponse timeout(String detail) {
        return new EntailmentResponse(Status.TIMEOUT, null, 0.0, detail);
    }

    public boolean isAvailable() {
        return status == Status.OK && label != null;
    }
}
