package com.example.giveaway_system.dto;

import com.example.giveaway_system.domain.EntryMode;

import java.util.Set;

/**
 * 응모 요청 DTO
 */
public record EntryRequest(
    String guildId,
    String giveawayId,
    String userId,
    Set<String> roleIds,   // 요청 시점의 사용자 보유 역할
    EntryMode expectedMode // 요청이 들어온 경로의 응모 방식
) {
    public EntryRequest {
        roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
    }
}
