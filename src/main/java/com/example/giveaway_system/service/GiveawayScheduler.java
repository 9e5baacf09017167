package com.example.giveaway_system.service;

import com.example.giveaway_system.config.GiveawayProperties;
import com.example.giveaway_system.domain.EntryMode;
import com.example.giveaway_system.domain.Giveaway;
import com.example.giveaway_system.dto.RecoveryReport;
import com.example.giveaway_system.repository.ModuleDataStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Giveaway 종료 타이머 관리.
 * Giveaway마다 최대 하나의 타이머만 유지하며, 최대 지연보다 긴 대기는 여러 번에 나누어 예약합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GiveawayScheduler {

    private final GiveawayRecordStore recordStore;
    private final GiveawayEndingService endingService;
    private final ReactionObserverRegistrar reactionObserverRegistrar;
    private final GiveawayCache cache;
    private final ModuleDataStore moduleDataStore;
    private final TaskScheduler taskScheduler;
    private final GiveawayProperties properties;
    private final Clock clock;

    public void scheduleEnd(Giveaway giveaway) {
        String giveawayId = giveaway.getId();
        String workspaceId = giveaway.getGuildId();

        if (giveaway.isEnded() || giveaway.isCancelled()) {
            reactionObserverRegistrar.release(giveaway);
            cache.disarm(giveawayId);
            return;
        }

        Instant now = clock.instant();
        Duration remaining = Duration.between(now, giveaway.getEndTime());
        if (remaining.isZero() || remaining.isNegative()) {
            log.info("### 종료 시각이 지난 Giveaway 즉시 처리: {}", giveawayId);
            endingService.processEnd(giveawayId, workspaceId);
            return;
        }

        Duration maxDelay = properties.scheduler().maxTimerDelay();
        if (remaining.compareTo(maxDelay) > 0) {
            // 최대 지연만큼만 기다린 뒤 레코드를 다시 읽어 남은 시간을 재예약
            arm(giveawayId, now.plus(maxDelay), () -> rescheduleFromStore(giveawayId, workspaceId));
            log.info("### 장기 Giveaway 중간 타이머 예약: {} (남은 시간 {})", giveawayId, remaining);
        } else {
            arm(giveawayId, giveaway.getEndTime(), () -> endingService.processEnd(giveawayId, workspaceId));
            log.info("### 종료 타이머 예약: {} (종료 {})", giveawayId, giveaway.getEndTime());
        }
    }

    /**
     * 저장된 모든 워크스페이스의 진행 중 Giveaway를 복구합니다.
     * 하나의 실패가 다른 Giveaway 복구를 막지 않습니다.
     */
    public RecoveryReport scheduleExisting() {
        int scheduled = 0;
        int processedImmediately = 0;

        List<String> workspaces = moduleDataStore.listWorkspacesWithData(properties.moduleNamespace());
        for (String workspaceId : workspaces) {
            List<Giveaway> records;
            try {
                records = recordStore.reloadFromStorage(workspaceId);
            } catch (RuntimeException e) {
                log.error("### 워크스페이스 데이터 복구 실패: {}, error={}", workspaceId, e.getMessage(), e);
                continue;
            }

            for (Giveaway giveaway : records) {
                if (giveaway.isEnded() || giveaway.isCancelled()) {
                    continue;
                }
                try {
                    if (!giveaway.getEndTime().isAfter(clock.instant())) {
                        endingService.processEnd(giveaway.getId(), workspaceId);
                        processedImmediately++;
                    } else {
                        if (giveaway.getEntryMode() == EntryMode.REACTION) {
                            reactionObserverRegistrar.register(giveaway);
                        }
                        scheduleEnd(giveaway);
                        scheduled++;
                    }
                } catch (RuntimeException e) {
                    log.error("### Giveaway 복구 실패: {}, error={}", giveaway.getId(), e.getMessage(), e);
                }
            }
        }

        log.info("### Giveaway 복구 완료: 예약 {}건, 즉시 종료 {}건", scheduled, processedImmediately);
        return new RecoveryReport(scheduled, processedImmediately);
    }

    public void cancelScheduled(String giveawayId) {
        cache.disarm(giveawayId);
    }

    private void rescheduleFromStore(String giveawayId, String workspaceId) {
        recordStore.get(giveawayId, workspaceId).ifPresentOrElse(
                this::scheduleEnd,
                () -> log.warn("### 재예약 대상 Giveaway가 삭제됨: {}", giveawayId));
    }

    /**
     * 기존 타이머를 해제하고 새 타이머를 등록합니다.
     * 실행 시점에 이미 교체된 타이머라면 작업을 수행하지 않습니다.
     */
    private void arm(String giveawayId, Instant fireAt, Runnable task) {
        ReentrantLock lock = cache.eventLock(giveawayId);
        AtomicReference<ScheduledFuture<?>> handle = new AtomicReference<>();

        lock.lock();
        try {
            cache.disarm(giveawayId);
            ScheduledFuture<?> timer = taskScheduler.schedule(() -> fire(giveawayId, handle, task), fireAt);
            handle.set(timer);
            cache.registerTimer(giveawayId, timer);
        } finally {
            lock.unlock();
        }
    }

    private void fire(String giveawayId, AtomicReference<ScheduledFuture<?>> handle, Runnable task) {
        boolean current;
        ReentrantLock lock = cache.eventLock(giveawayId);
        // 등록이 끝날 때까지 대기
        lock.lock();
        try {
            current = cache.releaseTimer(giveawayId, handle.get());
        } finally {
            lock.unlock();
        }

        if (!current) {
            log.debug("### 교체된 타이머 실행 생략: {}", giveawayId);
            return;
        }
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("### 종료 타이머 작업 실패: {}, error={}", giveawayId, e.getMessage(), e);
        }
    }
}
