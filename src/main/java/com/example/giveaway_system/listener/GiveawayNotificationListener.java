package com.example.giveaway_system.listener;

import com.example.giveaway_system.domain.EntryMode;
import com.example.giveaway_system.domain.Giveaway;
import com.example.giveaway_system.event.CompetitionPlacementEvent;
import com.example.giveaway_system.event.GiveawayCancelledEvent;
import com.example.giveaway_system.event.GiveawayEndedEvent;
import com.example.giveaway_system.platform.ChannelRef;
import com.example.giveaway_system.platform.ChatPlatformClient;
import com.example.giveaway_system.platform.ChatPlatformException;
import com.example.giveaway_system.platform.SentMessage;
import com.example.giveaway_system.service.GiveawayCache;
import com.example.giveaway_system.service.GiveawayMessageFormatter;
import com.example.giveaway_system.service.GiveawayRecordStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 결과/취소/리더보드 알림. 모든 단계는 실패해도 다음 단계와 저장된 상태에 영향을 주지 않습니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GiveawayNotificationListener {

    private final ChatPlatformClient platformClient;
    private final GiveawayRecordStore recordStore;
    private final GiveawayCache cache;

    @EventListener
    public void handleEnded(GiveawayEndedEvent event) {
        Giveaway giveaway = event.giveaway();

        if (!isSendable(giveaway)) {
            log.error("### 결과 알림 채널에 메시지를 보낼 수 없습니다: giveaway={}, channel={}",
                    giveaway.getId(), giveaway.getChannelId());
            return;
        }

        SentMessage result = null;
        try {
            result = platformClient.sendMessage(giveaway.getChannelId(), GiveawayMessageFormatter.results(giveaway));
        } catch (ChatPlatformException e) {
            log.error("### 결과 메시지 전송 실패: giveaway={}, error={}", giveaway.getId(), e.getMessage());
        }

        if (!announcementExists(giveaway)) {
            log.warn("### 원본 안내 메시지를 찾을 수 없습니다. 삭제되었을 수 있음: giveaway={}", giveaway.getId());
            return;
        }

        try {
            String resultUrl = result != null ? result.url() : "-";
            platformClient.editMessage(giveaway.getChannelId(), giveaway.getMessageId(),
                    GiveawayMessageFormatter.endedAnnouncement(giveaway, resultUrl));
        } catch (ChatPlatformException e) {
            log.error("### 종료 안내 메시지 수정 실패: giveaway={}, error={}", giveaway.getId(), e.getMessage());
        }

        stripReactions(giveaway);
    }

    @EventListener
    public void handleCancelled(GiveawayCancelledEvent event) {
        Giveaway giveaway = event.giveaway();

        if (!announcementExists(giveaway)) {
            log.warn("### 취소된 Giveaway의 원본 메시지를 찾을 수 없습니다: {}", giveaway.getId());
            return;
        }
        try {
            platformClient.editMessage(giveaway.getChannelId(), giveaway.getMessageId(),
                    GiveawayMessageFormatter.cancelledAnnouncement(giveaway));
        } catch (ChatPlatformException e) {
            log.error("### 취소 안내 메시지 수정 실패: giveaway={}, error={}", giveaway.getId(), e.getMessage());
        }
        stripReactions(giveaway);
    }

    /**
     * 이벤트에 담긴 사본 대신 저장된 최신 레코드로 리더보드를 다시 그립니다.
     * 종료 처리와 같은 잠금 안에서 확인하므로 종료 안내를 덮어쓰지 않습니다.
     */
    @EventListener
    public void handlePlacement(CompetitionPlacementEvent event) {
        String giveawayId = event.giveaway().getId();
        ReentrantLock lock = cache.eventLock(giveawayId);
        lock.lock();
        try {
            Optional<Giveaway> current = recordStore.get(giveawayId, event.giveaway().getGuildId());
            if (current.isEmpty() || current.get().isEnded()) {
                log.debug("### 종료되었거나 없는 Giveaway의 리더보드 갱신 생략: {}", giveawayId);
                return;
            }
            Giveaway giveaway = current.get();
            if (giveaway.getMessageId() == null) {
                return;
            }
            platformClient.editMessage(giveaway.getChannelId(), giveaway.getMessageId(),
                    GiveawayMessageFormatter.leaderboard(giveaway));
        } catch (ChatPlatformException e) {
            log.warn("### 리더보드 갱신 실패: giveaway={}, error={}", giveawayId, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private boolean isSendable(Giveaway giveaway) {
        try {
            ChannelRef channel = platformClient.fetchChannel(giveaway.getGuildId(), giveaway.getChannelId());
            return channel != null && channel.sendable();
        } catch (ChatPlatformException e) {
            log.error("### 채널 조회 실패: giveaway={}, error={}", giveaway.getId(), e.getMessage());
            return false;
        }
    }

    private boolean announcementExists(Giveaway giveaway) {
        if (giveaway.getMessageId() == null) {
            return false;
        }
        try {
            return platformClient.messageExists(giveaway.getChannelId(), giveaway.getMessageId());
        } catch (ChatPlatformException e) {
            log.warn("### 원본 메시지 조회 실패: giveaway={}, error={}", giveaway.getId(), e.getMessage());
            return false;
        }
    }

    private void stripReactions(Giveaway giveaway) {
        if (giveaway.getEntryMode() != EntryMode.REACTION) {
            return;
        }
        try {
            platformClient.removeAllReactions(giveaway.getChannelId(), giveaway.getMessageId());
        } catch (ChatPlatformException e) {
            log.warn("### 리액션 제거 실패: giveaway={}, error={}", giveaway.getId(), e.getMessage());
        }
    }
}
