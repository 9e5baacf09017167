package com.example.giveaway_system.service;

import com.example.giveaway_system.domain.EntryMode;
import com.example.giveaway_system.domain.Giveaway;
import com.example.giveaway_system.platform.ChatPlatformClient;
import com.example.giveaway_system.platform.ChatPlatformException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

/**
 * 리액션 모드 Giveaway의 리액션 구독 등록/해제.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReactionObserverRegistrar {

    private final ChatPlatformClient platformClient;
    private final ReactionEntryPublisher reactionEntryPublisher;

    public void register(Giveaway giveaway) {
        if (!observable(giveaway)) {
            return;
        }
        String guildId = giveaway.getGuildId();
        String giveawayId = giveaway.getId();
        try {
            platformClient.registerReactionObserver(giveaway.getMessageId(), giveaway.getReactionIdentifier(),
                    (user, roleIds) -> {
                        if (user.bot()) {
                            return;
                        }
                        reactionEntryPublisher.publish(guildId, giveawayId, user.id(), roleIds);
                    },
                    giveaway.getEndTime());
            log.info("### 리액션 구독 등록: giveaway={}, message={}", giveawayId, giveaway.getMessageId());
        } catch (ChatPlatformException e) {
            log.error("### 리액션 구독 등록 실패: giveaway={}, error={}", giveawayId, e.getMessage());
        }
    }

    public void release(Giveaway giveaway) {
        if (!observable(giveaway)) {
            return;
        }
        try {
            platformClient.unregisterReactionObserver(giveaway.getMessageId());
        } catch (ChatPlatformException e) {
            log.warn("### 리액션 구독 해제 실패: giveaway={}, error={}", giveaway.getId(), e.getMessage());
        }
    }

    private boolean observable(Giveaway giveaway) {
        return giveaway.getEntryMode() == EntryMode.REACTION
                && giveaway.getMessageId() != null
                && giveaway.getReactionIdentifier() != null;
    }
}
