package com.example.giveaway_system.service;

import com.example.giveaway_system.domain.EntryMode;
import com.example.giveaway_system.domain.Giveaway;
import com.example.giveaway_system.dto.EntryRequest;
import com.example.giveaway_system.dto.EntryResult;
import com.example.giveaway_system.event.CompetitionPlacementEvent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 응모 처리 (버튼 / 리액션 / 퀴즈 / 경쟁).
 * 검증부터 저장까지 이벤트 락 안에서 수행되어 같은 Giveaway에 대한 응모가 섞이지 않습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GiveawayEntryService {

    private final EntryValidator entryValidator;
    private final GiveawayRecordStore recordStore;
    private final RedisAttemptCounter attemptCounter;
    private final GiveawayEndingService endingService;
    private final GiveawayCache cache;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * 답변 입력창을 띄우기 전 응모 자격만 확인합니다.
     */
    public EntryValidation checkEligibility(EntryRequest request) {
        return entryValidator.validate(request);
    }

    public EntryResult enterByButton(EntryRequest request) {
        return enterDirectly(request, EntryMode.BUTTON);
    }

    public EntryResult enterByReaction(EntryRequest request) {
        return enterDirectly(request, EntryMode.REACTION);
    }

    private EntryResult enterDirectly(EntryRequest request, EntryMode mode) {
        ReentrantLock lock = cache.eventLock(request.giveawayId());
        lock.lock();
        try {
            EntryValidation validation = entryValidator.validate(withMode(request, mode));
            if (!validation.valid()) {
                return EntryResult.rejected(validation.rejection(), validation.message());
            }

            recordStore.update(request.giveawayId(), request.guildId(), g -> g.addParticipant(request.userId()));
            log.info("### 응모 완료: giveaway={}, user={}, mode={}", request.giveawayId(), request.userId(), mode);
            return EntryResult.accepted("You have successfully entered the giveaway! 🎉");
        } finally {
            lock.unlock();
        }
    }

    /**
     * [퀴즈 모드] 정답이면 참여자로 등록, 오답이면 시도 횟수를 1 증가시킵니다.
     */
    public EntryResult answerTrivia(EntryRequest request, String answer) {
        ReentrantLock lock = cache.eventLock(request.giveawayId());
        lock.lock();
        try {
            EntryValidation validation = entryValidator.validate(withMode(request, EntryMode.TRIVIA));
            if (!validation.valid()) {
                return EntryResult.rejected(validation.rejection(), validation.message());
            }
            Giveaway giveaway = validation.giveaway();
            if (giveaway.getTriviaAnswer() == null) {
                return EntryResult.rejected(EntryRejection.ANSWER_NOT_SET, EntryRejection.ANSWER_NOT_SET.format());
            }

            if (!isCorrect(giveaway, answer)) {
                return wrongAnswer(giveaway, request.userId());
            }

            recordStore.update(giveaway.getId(), request.guildId(), g -> g.addParticipant(request.userId()));
            log.info("### 퀴즈 정답 응모: giveaway={}, user={}", giveaway.getId(), request.userId());
            return EntryResult.accepted("Correct! You've entered the giveaway. 🎉");
        } finally {
            lock.unlock();
        }
    }

    /**
     * [경쟁 모드] 정답 도착 순서대로 순위를 배정하고, 모든 순위가 채워지면 즉시 종료합니다.
     */
    public EntryResult answerCompetition(EntryRequest request, String answer) {
        Giveaway placed;
        int placement;

        ReentrantLock lock = cache.eventLock(request.giveawayId());
        lock.lock();
        try {
            EntryValidation validation = entryValidator.validate(withMode(request, EntryMode.COMPETITION));
            if (!validation.valid()) {
                return EntryResult.rejected(validation.rejection(), validation.message());
            }
            Giveaway giveaway = validation.giveaway();
            if (giveaway.getTriviaAnswer() == null) {
                return EntryResult.rejected(EntryRejection.ANSWER_NOT_SET, EntryRejection.ANSWER_NOT_SET.format());
            }

            if (!isCorrect(giveaway, answer)) {
                return wrongAnswer(giveaway, request.userId());
            }

            placement = giveaway.assignPlacement(request.userId());
            recordStore.update(giveaway.getId(), request.guildId(), g -> g.assignPlacement(request.userId()));
            placed = giveaway;
            log.info("### 경쟁 모드 순위 확정: giveaway={}, user={}, placement={}",
                    giveaway.getId(), request.userId(), placement);
        } finally {
            lock.unlock();
        }

        if (placed.isLiveLeaderboard()) {
            eventPublisher.publishEvent(new CompetitionPlacementEvent(placed.copy(), request.userId(), placement));
        }
        if (placed.placementCount() >= placed.getWinnerCount()) {
            log.info("### 모든 순위가 채워져 자동 종료: {}", placed.getId());
            endingService.processEnd(placed.getId(), request.guildId());
        }

        return EntryResult.placed(placement, GiveawayMessageFormatter.placementEmoji(placement)
                + " **Congratulations!** You placed **" + GiveawayMessageFormatter.placementText(placement)
                + "** in the competition!\n\nYour prize will be revealed when the competition ends.");
    }

    private EntryResult wrongAnswer(Giveaway giveaway, String userId) {
        int attempts = attemptCounter.increment(giveaway, userId);
        String message = "Sorry, that's not the right answer. ";

        if (!giveaway.hasAttemptLimit()) {
            return EntryResult.wrongAnswer(null, message + "Try again!");
        }
        int attemptsLeft = Math.max(0, giveaway.getMaxTriviaAttempts() - attempts);
        return EntryResult.wrongAnswer(attemptsLeft, attemptsLeft > 0
                ? message + "You have **" + attemptsLeft + "** attempt(s) left."
                : message + "You have no more attempts left.");
    }

    // 앞뒤 공백 무시, 대소문자 구분 없음
    private boolean isCorrect(Giveaway giveaway, String answer) {
        if (answer == null) {
            return false;
        }
        return giveaway.getTriviaAnswer().trim().toLowerCase(Locale.ROOT)
                .equals(answer.trim().toLowerCase(Locale.ROOT));
    }

    private EntryRequest withMode(EntryRequest request, EntryMode mode) {
        return new EntryRequest(request.guildId(), request.giveawayId(), request.userId(), request.roleIds(), mode);
    }
}
