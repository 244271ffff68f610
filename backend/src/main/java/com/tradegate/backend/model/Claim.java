package com.tradegate.backend.model;

public record Claim(String text) {

    public Claim {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Claim text must not be blank");
        }
        text = text.strip();
    }

    public static Claim of(String text) {
        return new Claim(text);
    }
}
