package com.example.giveaway_system.service;

import com.example.giveaway_system.domain.Giveaway;
import com.example.giveaway_system.event.GiveawayEndedEvent;
import com.example.giveaway_system.platform.ChatPlatformClient;
import com.example.giveaway_system.platform.ChatPlatformException;
import com.example.giveaway_system.service.strategy.WinnerSelection;
import com.example.giveaway_system.service.strategy.WinnerSelectionStrategyFactory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Giveaway 종료 처리 (참여자 동기화 → 추첨 → 저장 → 결과 알림).
 * 같은 Giveaway에 대한 종료는 이벤트 락으로 직렬화되며 여러 번 호출되어도 한 번만 수행됩니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GiveawayEndingService {

    private final GiveawayRecordStore recordStore;
    private final GiveawayCache cache;
    private final ParticipantReconciler participantReconciler;
    private final ReactionObserverRegistrar reactionObserverRegistrar;
    private final WinnerSelectionStrategyFactory strategyFactory;
    private final ChatPlatformClient platformClient;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * @return 이번 호출로 종료 처리가 수행되었으면 true
     */
    public boolean processEnd(String giveawayId, String workspaceId) {
        Giveaway ended;

        ReentrantLock lock = cache.eventLock(giveawayId);
        lock.lock();
        try {
            Optional<Giveaway> found = recordStore.get(giveawayId, workspaceId);
            if (found.isEmpty()) {
                log.warn("### 종료 대상 Giveaway가 없습니다: {}", giveawayId);
                cache.disarm(giveawayId);
                return false;
            }

            Giveaway giveaway = found.get();
            if (giveaway.isEnded()) {
                // 취소된 레코드도 ended로 정규화되어 있음
                log.info("### 이미 종료된 Giveaway - 건너뜀: {} (cancelled={})", giveawayId, giveaway.isCancelled());
                cache.disarm(giveawayId);
                return false;
            }

            log.info("### Giveaway 종료 처리 시작: {}", giveawayId);
            reactionObserverRegistrar.release(giveaway);
            giveaway = participantReconciler.reconcile(giveaway);

            WinnerSelection selection = strategyFactory.getStrategy(giveaway.getEntryMode())
                    .select(giveaway, this::isResolvable);

            recordStore.update(giveawayId, workspaceId,
                    g -> g.markEnded(selection.winners(), selection.prizeAssignments()));
            cache.disarm(giveawayId);

            giveaway.markEnded(selection.winners(), selection.prizeAssignments());
            ended = giveaway;
            log.info("### Giveaway 종료 완료: {} (참여자 {}명, 당첨자 {}명)",
                    giveawayId, ended.getParticipants().size(), ended.getWinners().size());
        } finally {
            lock.unlock();
        }

        // 결과 알림은 락 해제 후 수행 (실패해도 저장된 결과에 영향 없음)
        eventPublisher.publishEvent(new GiveawayEndedEvent(ended.copy()));
        return true;
    }

    private boolean isResolvable(String userId) {
        try {
            return platformClient.fetchUser(userId) != null;
        } catch (ChatPlatformException e) {
            log.error("### 사용자 조회 실패: user={}, error={}", userId, e.getMessage());
            return false;
        }
    }
}
