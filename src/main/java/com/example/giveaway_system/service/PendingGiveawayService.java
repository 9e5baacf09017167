package com.example.giveaway_system.service;

import com.example.giveaway_system.config.GiveawayProperties;
import com.example.giveaway_system.domain.EntryMode;
import com.example.giveaway_system.domain.Giveaway;
import com.example.giveaway_system.domain.PendingGiveaway;
import com.example.giveaway_system.domain.PendingStatus;
import com.example.giveaway_system.platform.ChannelRef;
import com.example.giveaway_system.platform.ChatPlatformClient;
import com.example.giveaway_system.platform.ChatPlatformException;
import com.example.giveaway_system.platform.SentMessage;
import com.example.giveaway_system.repository.ModuleDataStore;
import com.fasterxml.jackson.core.type.TypeReference;

import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Giveaway 초안(Pending) 관리 및 시작.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PendingGiveawayService {

    public static final String PENDING_FILE = "pending-giveaways.json";

    private static final TypeReference<List<PendingGiveaway>> PENDING_LIST = new TypeReference<>() {};

    private final ModuleDataStore moduleDataStore;
    private final GiveawayRecordStore recordStore;
    private final GiveawayScheduler scheduler;
    private final ReactionObserverRegistrar reactionObserverRegistrar;
    private final ChatPlatformClient platformClient;
    private final GiveawayCache cache;
    private final GiveawayProperties properties;
    private final Clock clock;

    public PendingGiveaway create(String workspaceId, String creatorId) {
        PendingGiveaway pending = PendingGiveaway.draft(UUID.randomUUID().toString(), workspaceId, creatorId,
                clock.instant());
        modify(workspaceId, drafts -> drafts.add(pending));
        log.info("### Giveaway 초안 생성: {} (workspace: {}, creator: {})", pending.getId(), workspaceId, creatorId);
        return pending.copy();
    }

    public Optional<PendingGiveaway> get(String workspaceId, String pendingId) {
        return load(workspaceId).stream()
                .filter(p -> p.getId().equals(pendingId))
                .findFirst();
    }

    public List<PendingGiveaway> list(String workspaceId) {
        return load(workspaceId);
    }

    public List<PendingGiveaway> listReady(String workspaceId) {
        return load(workspaceId).stream()
                .filter(p -> p.getStatus() == PendingStatus.READY)
                .toList();
    }

    /**
     * 초안에 변경을 적용합니다. 상태(status)는 저장 시점의 필드로부터 다시 계산됩니다.
     */
    public Optional<PendingGiveaway> update(String workspaceId, String pendingId, Consumer<PendingGiveaway> mutation) {
        List<PendingGiveaway> result = new ArrayList<>();
        modify(workspaceId, drafts -> drafts.stream()
                .filter(p -> p.getId().equals(pendingId))
                .findFirst()
                .ifPresent(p -> {
                    mutation.accept(p);
                    result.add(p.copy());
                }));

        if (result.isEmpty()) {
            log.warn("### 수정할 초안이 없습니다: {} (workspace: {})", pendingId, workspaceId);
            return Optional.empty();
        }
        return Optional.of(result.get(0));
    }

    /**
     * 관리자가 수동으로 ready 상태를 지정합니다.
     */
    public boolean pinReady(String workspaceId, String pendingId) {
        return update(workspaceId, pendingId, p -> p.setStatusPinned(true)).isPresent();
    }

    public boolean delete(String workspaceId, String pendingId) {
        boolean[] removed = {false};
        modify(workspaceId, drafts -> removed[0] = drafts.removeIf(p -> p.getId().equals(pendingId)));
        return removed[0];
    }

    public boolean isReadyToStart(PendingGiveaway pending) {
        return pending.isReadyToStart();
    }

    public Optional<String> validateForStart(PendingGiveaway pending) {
        return pending.validateForStart();
    }

    /**
     * 초안을 실제 Giveaway로 시작합니다.
     * 안내 메시지 게시 → 레코드 생성 → 초안 삭제 → 리액션 구독 → 종료 타이머 예약 순으로 진행합니다.
     */
    public Giveaway start(String workspaceId, String pendingId, String channelId) {
        PendingGiveaway pending = get(workspaceId, pendingId)
                .orElseThrow(() -> new EntityNotFoundException(
                        "Pending giveaway not found. It may have been deleted."));

        if (!pending.isReadyToStart()) {
            throw new IllegalStateException(pending.validateForStart().orElse("The giveaway is not ready to start."));
        }

        ChannelRef channel = fetchSendableChannel(workspaceId, channelId);

        Instant now = clock.instant();
        Giveaway giveaway = pending.toGiveaway(UUID.randomUUID().toString(), channel.id(), null, now);

        SentMessage announcement;
        try {
            announcement = platformClient.sendMessage(channel.id(), GiveawayMessageFormatter.announcement(giveaway));
        } catch (ChatPlatformException e) {
            throw new IllegalStateException("Failed to post the giveaway announcement.", e);
        }
        giveaway.attachAnnouncement(channel.id(), announcement.id());

        Giveaway created = recordStore.add(giveaway, workspaceId)
                .orElseThrow(() -> new IllegalStateException("Failed to save the giveaway."));
        delete(workspaceId, pendingId);
        log.info("### Giveaway 시작: {} (초안 {}, 종료 {})", created.getId(), pendingId, created.getEndTime());

        if (created.getEntryMode() == EntryMode.REACTION) {
            reactionObserverRegistrar.register(created);
            try {
                platformClient.addReaction(channel.id(), announcement.id(), created.getReactionIdentifier());
            } catch (ChatPlatformException e) {
                log.warn("### 초기 리액션 추가 실패: giveaway={}, error={}", created.getId(), e.getMessage());
            }
        }

        scheduler.scheduleEnd(created);
        return created;
    }

    private ChannelRef fetchSendableChannel(String workspaceId, String channelId) {
        ChannelRef channel;
        try {
            channel = platformClient.fetchChannel(workspaceId, channelId);
        } catch (ChatPlatformException e) {
            throw new IllegalStateException("Could not find a channel to post the giveaway in.", e);
        }
        if (channel == null || !channel.sendable()) {
            throw new IllegalStateException("Cannot post the giveaway in this channel.");
        }
        return channel;
    }

    private List<PendingGiveaway> load(String workspaceId) {
        List<PendingGiveaway> drafts = moduleDataStore.load(PENDING_FILE, workspaceId,
                properties.moduleNamespace(), PENDING_LIST, new ArrayList<>());
        return drafts == null ? new ArrayList<>() : new ArrayList<>(drafts);
    }

    // 초안 문서 전체를 읽고-수정하고-저장 (워크스페이스 락 안에서)
    private void modify(String workspaceId, Consumer<List<PendingGiveaway>> change) {
        ReentrantLock lock = cache.workspaceLock(workspaceId);
        lock.lock();
        try {
            List<PendingGiveaway> drafts = load(workspaceId);
            change.accept(drafts);
            moduleDataStore.save(PENDING_FILE, workspaceId, properties.moduleNamespace(), drafts);
        } finally {
            lock.unlock();
        }
    }
}
