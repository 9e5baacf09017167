package com.example.giveaway_system.service;

import com.example.giveaway_system.domain.Giveaway;
import com.example.giveaway_system.event.GiveawayCancelledEvent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 관리자 명령: 취소 / 강제 종료
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GiveawayLifecycleService {

    private final GiveawayRecordStore recordStore;
    private final GiveawayCache cache;
    private final GiveawayScheduler scheduler;
    private final GiveawayEndingService endingService;
    private final ReactionObserverRegistrar reactionObserverRegistrar;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * 진행 중인 Giveaway를 취소합니다. 당첨자는 선정하지 않습니다.
     * @return 이미 종료/취소되었거나 존재하지 않으면 false
     */
    public boolean cancel(String giveawayId, String workspaceId) {
        log.info("### Giveaway 취소 요청: {}", giveawayId);
        Giveaway cancelled;

        ReentrantLock lock = cache.eventLock(giveawayId);
        lock.lock();
        try {
            Optional<Giveaway> found = recordStore.get(giveawayId, workspaceId);
            if (found.isEmpty()) {
                log.warn("### 취소 실패: Giveaway가 없습니다. {}", giveawayId);
                return false;
            }
            Giveaway giveaway = found.get();
            if (giveaway.isCancelled()) {
                log.warn("### 취소 실패: 이미 취소된 Giveaway입니다. {}", giveawayId);
                return false;
            }
            if (giveaway.isEnded()) {
                log.warn("### 취소 실패: 이미 종료된 Giveaway입니다. {}", giveawayId);
                return false;
            }

            recordStore.update(giveawayId, workspaceId, Giveaway::markCancelled);
            scheduler.cancelScheduled(giveawayId);
            reactionObserverRegistrar.release(giveaway);

            giveaway.markCancelled();
            cancelled = giveaway;
        } finally {
            lock.unlock();
        }

        eventPublisher.publishEvent(new GiveawayCancelledEvent(cancelled.copy()));
        log.info("### Giveaway 취소 완료: {}", giveawayId);
        return true;
    }

    /**
     * 종료 시각과 관계없이 즉시 종료 처리합니다.
     */
    public boolean forceFinish(String giveawayId, String workspaceId) {
        log.info("### Giveaway 강제 종료 요청: {}", giveawayId);
        return endingService.processEnd(giveawayId, workspaceId);
    }
}
