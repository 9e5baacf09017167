package com.example.giveaway_system.Unit_Test;

import com.example.giveaway_system.config.GiveawayFixtures;
import com.example.giveaway_system.config.InMemoryModuleDataStore;
import com.example.giveaway_system.domain.EntryMode;
import com.example.giveaway_system.domain.Giveaway;
import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.giveaway_system.config.GiveawayFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class GiveawayTest {

    @Nested
    @DisplayName("생성 규칙")
    class Creation {

        @Test
        @DisplayName("실패: 종료 시각이 시작 시각보다 빠르거나 같으면 예외가 발생한다")
        void create_Fail_InvalidPeriod() {
            IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                    () -> GiveawayFixtures.active().endTime(NOW).build());

            assertEquals("종료 시각은 시작 시각보다 늦어야 합니다.", exception.getMessage());
        }

        @Test
        @DisplayName("실패: 당첨 인원이 1명 미만이면 예외가 발생한다")
        void create_Fail_WinnerCount() {
            assertThrows(IllegalArgumentException.class, () -> GiveawayFixtures.active().winnerCount(0).build());
        }

        @Test
        @DisplayName("성공: 시도 횟수 0 또는 미설정은 무제한(-1)으로 정규화된다")
        void create_NormalizeAttempts() {
            assertEquals(Giveaway.UNLIMITED_ATTEMPTS, GiveawayFixtures.active().maxTriviaAttempts(0).build().getMaxTriviaAttempts());
            assertEquals(Giveaway.UNLIMITED_ATTEMPTS, GiveawayFixtures.active().build().getMaxTriviaAttempts());
            assertEquals(3, GiveawayFixtures.active().maxTriviaAttempts(3).build().getMaxTriviaAttempts());
        }

        @Test
        @DisplayName("성공: 취소된 레코드는 항상 종료 상태로 읽힌다")
        void create_CancelledImpliesEnded() {
            Giveaway giveaway = GiveawayFixtures.active().cancelled(true).ended(false).build();

            assertTrue(giveaway.isEnded());
            assertTrue(giveaway.isLiveLeaderboard());
        }
    }

    @Nested
    @DisplayName("상태 전이")
    class Transitions {

        @Test
        @DisplayName("실패: 종료된 Giveaway에는 참여자를 추가할 수 없다")
        void addParticipant_Fail_AfterEnd() {
            Giveaway giveaway = GiveawayFixtures.active().build();
            giveaway.addParticipant("u1");
            giveaway.markEnded(List.of("u1"), Map.of("u1", "Gift Card"));

            assertThrows(IllegalStateException.class, () -> giveaway.addParticipant("u2"));
            assertThrows(IllegalStateException.class, () -> giveaway.mergeParticipants(List.of("u3")));
            assertEquals(Set.of("u1"), giveaway.getParticipants());
        }

        @Test
        @DisplayName("실패: 당첨자 수가 당첨 인원을 초과하면 종료 처리할 수 없다")
        void markEnded_Fail_TooManyWinners() {
            Giveaway giveaway = GiveawayFixtures.active().winnerCount(1).build();

            assertThrows(IllegalStateException.class, () -> giveaway.markEnded(List.of("u1", "u2"), Map.of()));
            assertFalse(giveaway.isEnded());
        }

        @Test
        @DisplayName("성공: 취소 시 당첨자는 비워지고 종료 상태가 된다")
        void markCancelled_Success() {
            Giveaway giveaway = GiveawayFixtures.active().build();

            giveaway.markCancelled();

            assertTrue(giveaway.isCancelled());
            assertTrue(giveaway.isEnded());
            assertTrue(giveaway.getWinners().isEmpty());
            assertThrows(IllegalStateException.class, giveaway::markCancelled);
        }

        @Test
        @DisplayName("성공: 경쟁 모드 순위는 도착 순서대로 0부터 배정된다")
        void assignPlacement_DenseRanking() {
            Giveaway giveaway = GiveawayFixtures.active()
                    .entryMode(EntryMode.COMPETITION)
                    .winnerCount(3)
                    .build();

            assertEquals(0, giveaway.assignPlacement("a"));
            assertEquals(1, giveaway.assignPlacement("b"));
            assertThrows(IllegalStateException.class, () -> giveaway.assignPlacement("a"));
            assertEquals(2, giveaway.assignPlacement("c"));
            assertThrows(IllegalStateException.class, () -> giveaway.assignPlacement("d"));

            assertThat(giveaway.usersByPlacement()).containsExactly("a", "b", "c");
            assertThat(giveaway.getParticipants()).containsExactlyInAnyOrder("a", "b", "c");
        }

        @Test
        @DisplayName("성공: 복사본을 변경해도 원본에는 영향이 없다")
        void copy_IsIndependent() {
            Giveaway original = GiveawayFixtures.active().build();
            Giveaway copy = original.copy();

            copy.addParticipant("u1");

            assertTrue(original.getParticipants().isEmpty());
        }

        @Test
        @DisplayName("성공: 종료 시각이 지나면 응모 불가 상태로 판단한다")
        void isOpenAt() {
            Giveaway giveaway = GiveawayFixtures.active().build();

            assertTrue(giveaway.isOpenAt(NOW.plus(Duration.ofMinutes(59))));
            assertFalse(giveaway.isOpenAt(NOW.plus(Duration.ofHours(1))));
        }
    }

    @Test
    @DisplayName("성공: JSON 저장 형식은 ISO-8601 시각과 소문자 응모 방식을 사용하며 모르는 필드는 무시한다")
    void json_Format() throws Exception {
        Giveaway giveaway = GiveawayFixtures.active()
                .id("g-1")
                .entryMode(EntryMode.REACTION)
                .reactionIdentifier("🎉")
                .participants(List.of("u1", "u2"))
                .build();

        String json = InMemoryModuleDataStore.MAPPER.writeValueAsString(List.of(giveaway));

        assertThat(json).contains("\"entryMode\":\"reaction\"");
        assertThat(json).contains("\"startTime\":\"2026-03-01T12:00:00Z\"");

        String withUnknown = json.replace("\"id\":\"g-1\"", "\"id\":\"g-1\",\"legacyField\":42");
        List<Giveaway> read = InMemoryModuleDataStore.MAPPER.readValue(withUnknown, new TypeReference<>() {});

        assertEquals("g-1", read.get(0).getId());
        assertEquals(EntryMode.REACTION, read.get(0).getEntryMode());
        assertThat(read.get(0).getParticipants()).containsExactly("u1", "u2");
        assertEquals(NOW, read.get(0).getStartTime());
    }
}
