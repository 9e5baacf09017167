package com.example.giveaway_system.service;

import com.example.giveaway_system.config.GiveawayProperties;
import com.example.giveaway_system.domain.Giveaway;
import com.example.giveaway_system.repository.ModuleDataStore;
import com.fasterxml.jackson.core.type.TypeReference;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Giveaway 레코드 CRUD.
 * 워크스페이스 문서 단위로 캐시하며, 모든 변경은 반환 전에 저장소에 먼저 기록됩니다.
 * 반환되는 레코드는 항상 복사본입니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GiveawayRecordStore {

    public static final String GIVEAWAYS_FILE = "giveaways.json";

    private static final TypeReference<List<Giveaway>> RECORD_LIST = new TypeReference<>() {};

    private final ModuleDataStore moduleDataStore;
    private final GiveawayCache cache;
    private final GiveawayProperties properties;
    private final Clock clock;

    public Optional<Giveaway> get(String giveawayId, String workspaceId) {
        return records(workspaceId).stream()
                .filter(g -> g.getId().equals(giveawayId))
                .findFirst()
                .map(Giveaway::copy);
    }

    /**
     * 새 레코드를 추가합니다. 같은 ID가 이미 있으면 추가하지 않습니다.
     */
    public Optional<Giveaway> add(Giveaway giveaway, String workspaceId) {
        ReentrantLock lock = cache.workspaceLock(workspaceId);
        lock.lock();
        try {
            List<Giveaway> current = records(workspaceId);
            boolean duplicated = current.stream().anyMatch(g -> g.getId().equals(giveaway.getId()));
            if (duplicated) {
                log.warn("### 이미 존재하는 Giveaway ID입니다. 추가하지 않습니다: {} (workspace: {})",
                        giveaway.getId(), workspaceId);
                return Optional.empty();
            }

            List<Giveaway> next = new ArrayList<>(current);
            next.add(giveaway.copy());
            persist(workspaceId, next);
            return Optional.of(giveaway.copy());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 레코드 복사본에 변경을 적용한 뒤 저장합니다.
     * 변경 중 도메인 예외가 발생하면 아무것도 저장되지 않고 예외가 그대로 전파됩니다.
     * @return 대상이 없으면 false
     */
    public boolean update(String giveawayId, String workspaceId, Consumer<Giveaway> mutation) {
        ReentrantLock lock = cache.workspaceLock(workspaceId);
        lock.lock();
        try {
            List<Giveaway> next = new ArrayList<>(records(workspaceId));
            for (int i = 0; i < next.size(); i++) {
                if (next.get(i).getId().equals(giveawayId)) {
                    Giveaway changed = next.get(i).copy();
                    mutation.accept(changed);
                    next.set(i, changed);
                    persist(workspaceId, next);
                    return true;
                }
            }
            log.warn("### 수정할 Giveaway를 찾을 수 없습니다: {} (workspace: {})", giveawayId, workspaceId);
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 레코드를 삭제하고 예약된 종료 타이머도 함께 해제합니다.
     */
    public boolean remove(String giveawayId, String workspaceId) {
        ReentrantLock lock = cache.workspaceLock(workspaceId);
        lock.lock();
        try {
            List<Giveaway> next = new ArrayList<>(records(workspaceId));
            boolean removed = next.removeIf(g -> g.getId().equals(giveawayId));
            if (!removed) {
                return false;
            }
            persist(workspaceId, next);
            cache.disarm(giveawayId);
            log.info("### Giveaway 삭제 완료: {} (workspace: {})", giveawayId, workspaceId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 시작 시각 내림차순 목록.
     * @param activeOnly true면 종료/취소되지 않고 종료 시각이 지나지 않은 것만
     */
    public List<Giveaway> listAll(String workspaceId, boolean activeOnly) {
        Instant now = clock.instant();
        return records(workspaceId).stream()
                .filter(g -> !activeOnly || g.isOpenAt(now))
                .sorted(Comparator.comparing(Giveaway::getStartTime).reversed())
                .map(Giveaway::copy)
                .toList();
    }

    /**
     * 캐시를 무시하고 저장소에서 다시 읽어 캐시를 갱신합니다.
     */
    public List<Giveaway> reloadFromStorage(String workspaceId) {
        ReentrantLock lock = cache.workspaceLock(workspaceId);
        lock.lock();
        try {
            List<Giveaway> loaded = loadFromStorage(workspaceId);
            cache.put(workspaceId, loaded);
            return loaded.stream().map(Giveaway::copy).toList();
        } finally {
            lock.unlock();
        }
    }

    public void clearCache(String workspaceId) {
        cache.evict(workspaceId);
    }

    private List<Giveaway> records(String workspaceId) {
        return cache.cached(workspaceId).orElseGet(() -> {
            ReentrantLock lock = cache.workspaceLock(workspaceId);
            lock.lock();
            try {
                // 락 대기 중 다른 스레드가 먼저 적재했을 수 있음
                return cache.cached(workspaceId).orElseGet(() -> {
                    List<Giveaway> loaded = loadFromStorage(workspaceId);
                    cache.put(workspaceId, loaded);
                    return cache.cached(workspaceId).orElse(List.of());
                });
            } finally {
                lock.unlock();
            }
        });
    }

    private List<Giveaway> loadFromStorage(String workspaceId) {
        List<Giveaway> loaded = moduleDataStore.load(GIVEAWAYS_FILE, workspaceId,
                properties.moduleNamespace(), RECORD_LIST, new ArrayList<>());
        return loaded == null ? new ArrayList<>() : loaded;
    }

    // 저장 성공 후에만 캐시 교체
    private void persist(String workspaceId, List<Giveaway> next) {
        moduleDataStore.save(GIVEAWAYS_FILE, workspaceId, properties.moduleNamespace(), next);
        cache.put(workspaceId, next);
    }
}
