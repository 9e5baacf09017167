package com.example.giveaway_system.Unit_Test;

import com.example.giveaway_system.config.InMemoryModuleDataStore;
import com.example.giveaway_system.domain.EntryMode;
import com.example.giveaway_system.domain.Giveaway;
import com.example.giveaway_system.domain.PendingGiveaway;
import com.example.giveaway_system.domain.PendingStatus;
import com.example.giveaway_system.domain.vo.GiveawayDuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PendingGiveawayTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private PendingGiveaway readyDraft() {
        PendingGiveaway pending = PendingGiveaway.draft("p-1", "guild-1", "creator", NOW);
        pending.setTitle("여름 경품 이벤트");
        pending.setPrizes(new ArrayList<>(List.of("Gift Card")));
        return pending;
    }

    @Test
    @DisplayName("성공: 새 초안은 기본값을 가지며 draft 상태이다")
    void draft_Defaults() {
        PendingGiveaway pending = PendingGiveaway.draft("p-1", "guild-1", "creator", NOW);

        assertEquals(PendingGiveaway.DEFAULT_TITLE, pending.getTitle());
        assertEquals(3_600_000L, pending.getDurationMs());
        assertEquals(1, pending.getWinnerCount());
        assertEquals(EntryMode.BUTTON, pending.getEntryMode());
        assertEquals(PendingStatus.DRAFT, pending.getStatus());
        assertEquals("Please set a title for the giveaway.", pending.validateForStart().orElseThrow());
    }

    @Test
    @DisplayName("성공: 필수 항목이 모두 채워지면 ready 상태로 계산된다")
    void status_Ready() {
        assertEquals(PendingStatus.READY, readyDraft().getStatus());
        assertTrue(readyDraft().isReadyToStart());
    }

    @Test
    @DisplayName("실패: 당첨 인원만큼의 경품 슬롯이 모두 채워지지 않으면 draft이다")
    void status_MissingPrizeSlot() {
        PendingGiveaway pending = readyDraft();
        pending.setWinnerCount(3);
        pending.setPrizes(new ArrayList<>(List.of("A", " ", "C")));

        assertEquals(PendingStatus.DRAFT, pending.getStatus());
        assertEquals("Please configure all 3 prizes.", pending.validateForStart().orElseThrow());
    }

    @Test
    @DisplayName("실패: 퀴즈/경쟁 모드는 질문과 정답, 리액션 모드는 이모지가 필요하다")
    void status_ModeSpecificFields() {
        PendingGiveaway trivia = readyDraft();
        trivia.setEntryMode(EntryMode.COMPETITION);
        trivia.setTriviaQuestion("2+2?");
        assertEquals("For competition mode, please set a trivia answer.", trivia.validateForStart().orElseThrow());

        PendingGiveaway reaction = readyDraft();
        reaction.setEntryMode(EntryMode.REACTION);
        assertEquals("For reaction mode, please set a reaction emoji.", reaction.validateForStart().orElseThrow());
    }

    @Test
    @DisplayName("성공: 수동 지정(pinned)된 초안은 제목과 경품이 없어도 ready이며 시작할 수 있다")
    void status_Pinned() {
        PendingGiveaway pending = PendingGiveaway.draft("p-1", "guild-1", "creator", NOW);
        pending.setStatusPinned(true);

        assertEquals(PendingStatus.READY, pending.getStatus());
        assertTrue(pending.isReadyToStart());
        assertTrue(pending.validateForStart().isEmpty());
    }

    @Test
    @DisplayName("실패: 수동 지정된 초안이라도 기간이나 응모 방식 필수 항목이 잘못되면 draft이다")
    void status_PinnedStillChecksStructure() {
        PendingGiveaway tooLong = PendingGiveaway.draft("p-1", "guild-1", "creator", NOW);
        tooLong.setStatusPinned(true);
        tooLong.setDurationMs(GiveawayDuration.MAX_DURATION.toMillis() + 1);

        assertEquals(PendingStatus.DRAFT, tooLong.getStatus());
        assertEquals("Please set a valid duration for the giveaway.", tooLong.validateForStart().orElseThrow());

        PendingGiveaway reaction = PendingGiveaway.draft("p-2", "guild-1", "creator", NOW);
        reaction.setStatusPinned(true);
        reaction.setEntryMode(EntryMode.REACTION);

        assertFalse(reaction.isReadyToStart());
        assertEquals(PendingStatus.DRAFT, reaction.getStatus());
    }

    @Test
    @DisplayName("실패: 진행 기간이 30일을 넘으면 시작할 수 없다")
    void status_DurationOverMax() {
        PendingGiveaway pending = readyDraft();
        pending.setDurationMs(GiveawayDuration.MAX_DURATION.toMillis());
        assertTrue(pending.isReadyToStart());

        pending.setDurationMs(GiveawayDuration.MAX_DURATION.plusDays(1).toMillis());
        assertEquals("Please set a valid duration for the giveaway.", pending.validateForStart().orElseThrow());
    }

    @Test
    @DisplayName("성공: status는 JSON에 기록되지만 읽을 때는 무시된다")
    void status_WrittenButNotRead() throws Exception {
        String json = InMemoryModuleDataStore.MAPPER.writeValueAsString(readyDraft());
        assertThat(json).contains("\"status\":\"ready\"");

        String stale = json.replace("\"status\":\"ready\"", "\"status\":\"draft\"");
        PendingGiveaway read = InMemoryModuleDataStore.MAPPER.readValue(stale, PendingGiveaway.class);

        assertEquals(PendingStatus.READY, read.getStatus());
        assertEquals(NOW, read.getCreatedAt());
    }

    @Test
    @DisplayName("성공: 시작 시 시작 시각과 종료 시각이 설정된 Giveaway로 변환된다")
    void toGiveaway() {
        PendingGiveaway pending = readyDraft();
        pending.setDurationMs(60_000L);

        Giveaway giveaway = pending.toGiveaway("g-1", "channel-1", "message-1", NOW);

        assertEquals(NOW, giveaway.getStartTime());
        assertEquals(NOW.plusSeconds(60), giveaway.getEndTime());
        assertEquals("creator", giveaway.getCreatorId());
        assertEquals(List.of("Gift Card"), giveaway.getPrizes());
        assertFalse(giveaway.isEnded());
    }

    @Test
    @DisplayName("성공: 경품이 당첨 인원보다 적어도 있는 경품만으로 변환된다")
    void toGiveaway_FewerPrizes() {
        PendingGiveaway pending = PendingGiveaway.draft("p-1", "guild-1", "creator", NOW);
        pending.setStatusPinned(true);
        pending.setWinnerCount(3);
        pending.setPrizes(new ArrayList<>(List.of("Gold")));

        Giveaway giveaway = pending.toGiveaway("g-1", "channel-1", "message-1", NOW);

        assertEquals(3, giveaway.getWinnerCount());
        assertEquals(List.of("Gold"), giveaway.getPrizes());
    }
}
