package com.example.giveaway_system.service;

import com.example.giveaway_system.domain.EntryMode;
import com.example.giveaway_system.domain.Giveaway;
import com.example.giveaway_system.platform.ChatPlatformClient;
import com.example.giveaway_system.platform.ChatPlatformException;
import com.example.giveaway_system.platform.PlatformUser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 리액션 모드 참여자 동기화.
 * 봇이 오프라인이거나 대기열에서 유실된 리액션을 종료 직전에 메시지에서 다시 읽어 병합합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParticipantReconciler {

    private final ChatPlatformClient platformClient;
    private final GiveawayRecordStore recordStore;

    /**
     * @return 병합된 참여자가 반영된 레코드 (동기화 불가 시 입력 그대로)
     */
    public Giveaway reconcile(Giveaway giveaway) {
        if (giveaway.getEntryMode() != EntryMode.REACTION
                || giveaway.getMessageId() == null
                || giveaway.getReactionIdentifier() == null) {
            return giveaway;
        }

        List<String> reactors;
        try {
            reactors = platformClient.fetchReactionUsers(giveaway.getChannelId(), giveaway.getMessageId(),
                            giveaway.getReactionIdentifier())
                    .stream()
                    .filter(user -> !user.bot())
                    .map(PlatformUser::id)
                    .filter(id -> !giveaway.hasParticipant(id))
                    .distinct()
                    .toList();
        } catch (ChatPlatformException e) {
            log.error("### 리액션 참여자 동기화 실패 - 저장된 참여자로 진행: giveaway={}, error={}",
                    giveaway.getId(), e.getMessage());
            return giveaway;
        }

        if (reactors.isEmpty()) {
            return giveaway;
        }

        // 추첨 전에 병합된 참여자 목록을 먼저 저장
        recordStore.update(giveaway.getId(), giveaway.getGuildId(), g -> g.mergeParticipants(reactors));
        giveaway.mergeParticipants(reactors);
        log.info("### 리액션 참여자 {}명 동기화: giveaway={} (총 {}명)",
                reactors.size(), giveaway.getId(), giveaway.getParticipants().size());
        return giveaway;
    }
}
