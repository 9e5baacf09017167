package com.example.giveaway_system.service;

import com.example.giveaway_system.domain.Giveaway;

/**
 * 응모 검증 결과. 통과 시 검증에 사용된 레코드를 함께 돌려줍니다.
 */
public record EntryValidation(Giveaway giveaway, EntryRejection rejection, String message) {

    public static EntryValidation passed(Giveaway giveaway) {
        return new EntryValidation(giveaway, null, null);
    }

    public static EntryValidation rejected(EntryRejection rejection, Object... args) {
        return new EntryValidation(null, rejection, rejection.format(args));
    }

    public boolean valid() {
        return rejection == null;
    }
}
