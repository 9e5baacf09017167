package com.example.giveaway_system.dto;

import com.example.giveaway_system.service.EntryRejection;

/**
 * 응모 처리 결과. 사용자에게 그대로 노출되는 메시지를 포함합니다.
 */
public record EntryResult(
    boolean accepted,
    String message,
    EntryRejection rejection,
    Integer placement,     // 경쟁 모드 순위 (0부터)
    Integer attemptsLeft   // 오답 시 남은 시도 횟수, 무제한이면 null
) {
    public static EntryResult accepted(String message) {
        return new EntryResult(true, message, null, null, null);
    }

    public static EntryResult placed(int placement, String message) {
        return new EntryResult(true, message, null, placement, null);
    }

    public static EntryResult rejected(EntryRejection rejection, String message) {
        return new EntryResult(false, message, rejection, null, null);
    }

    public static EntryResult wrongAnswer(Integer attemptsLeft, String message) {
        return new EntryResult(false, message, null, null, attemptsLeft);
    }
}
