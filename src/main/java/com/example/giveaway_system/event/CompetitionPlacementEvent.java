package com.example.giveaway_system.event;

import com.example.giveaway_system.domain.Giveaway;

// 경쟁 모드 순위 확정 (실시간 리더보드 갱신용)
public record CompetitionPlacementEvent(Giveaway giveaway, String userId, int placement) {}
