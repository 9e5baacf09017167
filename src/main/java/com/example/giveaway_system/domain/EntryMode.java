package com.example.giveaway_system.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum EntryMode {
    @JsonProperty("button") BUTTON("button"),         // 버튼 클릭 응모
    @JsonProperty("reaction") REACTION("reaction"),   // 이모지 리액션 응모
    @JsonProperty("trivia") TRIVIA("trivia"),         // 퀴즈 정답자 추첨
    @JsonProperty("competition") COMPETITION("competition"); // 선착순 정답 순위제

    private final String label;

    /**
     * 답변 시도 횟수 제한이 적용되는 모드인지 확인합니다.
     */
    public boolean isAttemptLimited() {
        return this == TRIVIA || this == COMPETITION;
    }

    public boolean requiresQuestion() {
        return this == TRIVIA || this == COMPETITION;
    }
}
