package com.example.giveaway_system.service;

import com.example.giveaway_system.domain.Giveaway;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 프로세스 내 공유 상태 보관소.
 * <ul>
 *     <li>워크스페이스별 Giveaway 레코드 캐시 (값은 교체만 되고 내부 변경은 없음)</li>
 *     <li>Giveaway ID별 종료 타이머 레지스트리</li>
 *     <li>이벤트별 / 워크스페이스별 락</li>
 * </ul>
 * 락 획득 순서는 항상 이벤트 락 → 워크스페이스 락입니다.
 */
@Slf4j
@Component
public class GiveawayCache {

    private final Map<String, List<Giveaway>> records = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> eventLocks = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> workspaceLocks = new ConcurrentHashMap<>();

    // ===== 레코드 캐시 =====

    public Optional<List<Giveaway>> cached(String workspaceId) {
        return Optional.ofNullable(records.get(workspaceId));
    }

    public void put(String workspaceId, List<Giveaway> giveaways) {
        records.put(workspaceId, List.copyOf(giveaways));
    }

    public void evict(String workspaceId) {
        records.remove(workspaceId);
    }

    // ===== 타이머 레지스트리 =====

    /**
     * 새 타이머를 등록합니다. 기존 타이머가 있으면 취소합니다.
     */
    public void registerTimer(String giveawayId, ScheduledFuture<?> timer) {
        ScheduledFuture<?> previous = timers.put(giveawayId, timer);
        if (previous != null && previous != timer) {
            previous.cancel(false);
        }
    }

    /**
     * 실행 직전의 타이머가 자신이 현재 등록된 타이머인지 확인하고 레지스트리에서 제거합니다.
     * @return 이미 교체되었거나 해제된 타이머라면 false
     */
    public boolean releaseTimer(String giveawayId, ScheduledFuture<?> timer) {
        return timer != null && timers.remove(giveawayId, timer);
    }

    public void disarm(String giveawayId) {
        ScheduledFuture<?> timer = timers.remove(giveawayId);
        if (timer != null) {
            timer.cancel(false);
            log.debug("### 종료 타이머 해제: {}", giveawayId);
        }
    }

    public boolean isArmed(String giveawayId) {
        return timers.containsKey(giveawayId);
    }

    // ===== 락 =====

    public ReentrantLock eventLock(String giveawayId) {
        return eventLocks.computeIfAbsent("GIVEAWAY_END_" + giveawayId, key -> new ReentrantLock());
    }

    public ReentrantLock workspaceLock(String workspaceId) {
        return workspaceLocks.computeIfAbsent("WORKSPACE_" + workspaceId, key -> new ReentrantLock());
    }
}
