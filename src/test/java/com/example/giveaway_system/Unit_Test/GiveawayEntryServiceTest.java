package com.example.giveaway_system.Unit_Test;

import com.example.giveaway_system.config.FakeRedisConfig;
import com.example.giveaway_system.config.GiveawayFixtures;
import com.example.giveaway_system.config.GiveawayProperties;
import com.example.giveaway_system.config.InMemoryModuleDataStore;
import com.example.giveaway_system.config.MutableClock;
import com.example.giveaway_system.domain.EntryMode;
import com.example.giveaway_system.domain.Giveaway;
import com.example.giveaway_system.dto.EntryRequest;
import com.example.giveaway_system.dto.EntryResult;
import com.example.giveaway_system.event.CompetitionPlacementEvent;
import com.example.giveaway_system.service.EntryRejection;
import com.example.giveaway_system.service.EntryValidator;
import com.example.giveaway_system.service.GiveawayCache;
import com.example.giveaway_system.service.GiveawayEndingService;
import com.example.giveaway_system.service.GiveawayEntryService;
import com.example.giveaway_system.service.GiveawayRecordStore;
import com.example.giveaway_system.service.RedisAttemptCounter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.example.giveaway_system.config.GiveawayFixtures.GUILD;
import static com.example.giveaway_system.config.GiveawayFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class GiveawayEntryServiceTest {

    @Mock
    private GiveawayEndingService endingService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private GiveawayRecordStore recordStore;
    private GiveawayEntryService entryService;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW.plus(Duration.ofMinutes(5)));
        GiveawayCache cache = new GiveawayCache();
        recordStore = new GiveawayRecordStore(new InMemoryModuleDataStore(), cache, GiveawayProperties.defaults(), clock);
        RedisAttemptCounter attemptCounter =
                new RedisAttemptCounter(FakeRedisConfig.fakeRedisTemplate(new ConcurrentHashMap<>()));
        EntryValidator validator = new EntryValidator(recordStore, attemptCounter, clock);
        entryService = new GiveawayEntryService(validator, recordStore, attemptCounter, endingService, cache, eventPublisher);
    }

    private EntryRequest request(Giveaway giveaway, String userId) {
        return new EntryRequest(GUILD, giveaway.getId(), userId, Set.of(), giveaway.getEntryMode());
    }

    @Test
    @DisplayName("성공: 버튼 응모 시 참여자로 등록되고, 두 번째 응모는 거절된다")
    void enterByButton() {
        Giveaway giveaway = GiveawayFixtures.active().build();
        recordStore.add(giveaway, GUILD);

        EntryResult first = entryService.enterByButton(request(giveaway, "u1"));
        EntryResult second = entryService.enterByButton(request(giveaway, "u1"));

        assertTrue(first.accepted());
        assertFalse(second.accepted());
        assertEquals(EntryRejection.ALREADY_ENTERED, second.rejection());
        assertEquals(Set.of("u1"), recordStore.get(giveaway.getId(), GUILD).orElseThrow().getParticipants());
    }

    @Test
    @DisplayName("성공: 동시에 응모해도 모든 참여자가 누락 없이 기록된다")
    void enterByButton_Concurrent() throws InterruptedException {
        Giveaway giveaway = GiveawayFixtures.active().build();
        recordStore.add(giveaway, GUILD);

        int threadCount = 50;
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch latch = new CountDownLatch(threadCount);
        List<EntryResult> results = Collections.synchronizedList(new ArrayList<>());

        for (int i = 0; i < threadCount; i++) {
            String userId = "u" + (i % 25); // 25명이 두 번씩 응모
            executor.submit(() -> {
                try {
                    results.add(entryService.enterByButton(request(giveaway, userId)));
                } finally {
                    latch.countDown();
                }
            });
        }
        assertTrue(latch.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(25, recordStore.get(giveaway.getId(), GUILD).orElseThrow().getParticipants().size());
        assertEquals(25, results.stream().filter(EntryResult::accepted).count());
    }

    @Test
    @DisplayName("성공: 퀴즈 정답은 대소문자와 앞뒤 공백을 무시하고 비교한다")
    void answerTrivia_Correct() {
        Giveaway giveaway = GiveawayFixtures.active()
                .entryMode(EntryMode.TRIVIA).triviaQuestion("수도는?").triviaAnswer("Seoul").build();
        recordStore.add(giveaway, GUILD);

        EntryResult result = entryService.answerTrivia(request(giveaway, "u1"), "  seOUL ");

        assertTrue(result.accepted());
        assertTrue(recordStore.get(giveaway.getId(), GUILD).orElseThrow().hasParticipant("u1"));
    }

    @Test
    @DisplayName("실패: 퀴즈 오답 시 남은 시도 횟수를 안내하고, 모두 소진하면 더 이상 답할 수 없다")
    void answerTrivia_WrongAnswers() {
        Giveaway giveaway = GiveawayFixtures.active()
                .entryMode(EntryMode.TRIVIA).triviaQuestion("q").triviaAnswer("a").maxTriviaAttempts(2).build();
        recordStore.add(giveaway, GUILD);

        EntryResult first = entryService.answerTrivia(request(giveaway, "u1"), "x");
        EntryResult second = entryService.answerTrivia(request(giveaway, "u1"), "y");
        EntryResult third = entryService.answerTrivia(request(giveaway, "u1"), "a");

        assertEquals(1, first.attemptsLeft());
        assertEquals("Sorry, that's not the right answer. You have **1** attempt(s) left.", first.message());
        assertEquals(0, second.attemptsLeft());
        assertEquals(EntryRejection.ATTEMPTS_EXHAUSTED, third.rejection());
        assertFalse(recordStore.get(giveaway.getId(), GUILD).orElseThrow().hasParticipant("u1"));
    }

    @Test
    @DisplayName("실패: 시도 제한이 없으면 오답 후 다시 시도하라고 안내한다")
    void answerTrivia_Unlimited() {
        Giveaway giveaway = GiveawayFixtures.active()
                .entryMode(EntryMode.TRIVIA).triviaQuestion("q").triviaAnswer("a").build();
        recordStore.add(giveaway, GUILD);

        EntryResult result = entryService.answerTrivia(request(giveaway, "u1"), "wrong");

        assertNull(result.attemptsLeft());
        assertEquals("Sorry, that's not the right answer. Try again!", result.message());
    }

    @Test
    @DisplayName("성공: 경쟁 모드는 k번째 정답자에게 k-1 순위를 배정하고 다 차면 자동 종료한다")
    void answerCompetition_PlacementsAndAutoEnd() {
        Giveaway giveaway = GiveawayFixtures.active()
                .entryMode(EntryMode.COMPETITION).triviaQuestion("q").triviaAnswer("answer")
                .winnerCount(2).prizes(List.of("Gold", "Silver")).build();
        recordStore.add(giveaway, GUILD);

        EntryResult first = entryService.answerCompetition(request(giveaway, "a"), "answer");
        verify(endingService, never()).processEnd(anyString(), anyString());

        EntryResult second = entryService.answerCompetition(request(giveaway, "b"), "ANSWER");

        assertEquals(0, first.placement());
        assertEquals(1, second.placement());
        assertThat(first.message()).contains("🥇 1st");
        assertThat(recordStore.get(giveaway.getId(), GUILD).orElseThrow().getCompetitionPlacements())
                .containsEntry("a", 0).containsEntry("b", 1);
        verify(endingService).processEnd(giveaway.getId(), GUILD);

        ArgumentCaptor<CompetitionPlacementEvent> captor = ArgumentCaptor.forClass(CompetitionPlacementEvent.class);
        verify(eventPublisher, times(2)).publishEvent(captor.capture());
        assertEquals(1, captor.getAllValues().get(1).placement());
    }

    @Test
    @DisplayName("성공: 실시간 리더보드가 꺼져 있으면 순위 이벤트를 발행하지 않는다")
    void answerCompetition_NoLeaderboard() {
        Giveaway giveaway = GiveawayFixtures.active()
                .entryMode(EntryMode.COMPETITION).triviaQuestion("q").triviaAnswer("answer")
                .winnerCount(3).liveLeaderboard(false).build();
        recordStore.add(giveaway, GUILD);

        entryService.answerCompetition(request(giveaway, "a"), "answer");

        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }
}
