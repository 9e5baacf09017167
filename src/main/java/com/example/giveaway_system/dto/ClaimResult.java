package com.example.giveaway_system.dto;

import java.util.List;

public record ClaimResult(
    Status status,
    String message,
    List<String> revealedPrizes,
    boolean previouslyClaimed
) {
    public enum Status {
        NOT_FOUND,
        NOT_ENDED,
        CANCELLED,
        WINNER,
        ADMIN_VIEW,
        NOT_WINNER
    }

    public static ClaimResult of(Status status, String message) {
        return new ClaimResult(status, message, List.of(), false);
    }
}
