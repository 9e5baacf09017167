package com.example.giveaway_system.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PendingStatus {
    @JsonProperty("draft") DRAFT,   // 필수 항목 미입력
    @JsonProperty("ready") READY    // 시작 가능
}
