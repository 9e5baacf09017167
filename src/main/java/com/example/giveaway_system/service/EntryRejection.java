package com.example.giveaway_system.service;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 응모 거절 사유. 메시지는 사용자에게 그대로 노출됩니다.
 */
@Getter
@RequiredArgsConstructor
public enum EntryRejection {
    NOT_FOUND("This giveaway could not be found."),
    WRONG_MODE("This giveaway does not use %s entry."),
    NOT_ACTIVE("This giveaway is no longer active."),
    MISSING_REQUIRED_ROLE("You don't have one of the required roles to enter this giveaway."),
    BLOCKED_ROLE("You have a role that is blocked from entering this giveaway."),
    COMPETITION_FULL("This competition has already found all its winners!"),
    ALREADY_PLACED("You already placed %s in this competition!"),
    ATTEMPTS_EXHAUSTED("You have no more attempts left. (Max: %d)"),
    ALREADY_ANSWERED("You have already successfully answered the trivia for this giveaway!"),
    ALREADY_ENTERED("You are already entered in this giveaway!"),
    ANSWER_NOT_SET("The answer is not set. Please contact an admin.");

    private final String messageTemplate;

    public String format(Object... args) {
        return String.format(messageTemplate, args);
    }
}
