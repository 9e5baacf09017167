package com.example.giveaway_system.event;

import com.example.giveaway_system.domain.Giveaway;

/**
 * 추첨이 확정되어 저장된 직후 발행됩니다. giveaway는 저장된 상태의 스냅샷입니다.
 */
public record GiveawayEndedEvent(Giveaway giveaway) {}
