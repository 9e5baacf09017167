package com.example.giveaway_system.consumer;

import com.example.giveaway_system.domain.EntryMode;
import com.example.giveaway_system.dto.EntryRequest;
import com.example.giveaway_system.dto.EntryResult;
import com.example.giveaway_system.service.EntryRejection;
import com.example.giveaway_system.service.GiveawayEntryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

// parse()가 package-private이라 같은 패키지에 둠
@ExtendWith(MockitoExtension.class)
class ReactionEntryConsumerTest {

    @Mock
    private GiveawayEntryService entryService;

    @InjectMocks
    private ReactionEntryConsumer consumer;

    @Test
    @DisplayName("성공: 메시지를 응모 요청으로 변환한다")
    void parse_Success() {
        EntryRequest request = ReactionEntryConsumer.parse("guild-1:g-1:u-1:r1,r2");

        assertEquals("guild-1", request.guildId());
        assertEquals("g-1", request.giveawayId());
        assertEquals("u-1", request.userId());
        assertEquals(Set.of("r1", "r2"), request.roleIds());
        assertEquals(EntryMode.REACTION, request.expectedMode());
    }

    @Test
    @DisplayName("성공: 역할이 없으면 빈 역할 집합으로 변환한다")
    void parse_NoRoles() {
        assertTrue(ReactionEntryConsumer.parse("guild-1:g-1:u-1:").roleIds().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "guild-1:g-1:u-1", "guild-1:g-1:u-1:r1:extra", ":g-1:u-1:", "guild-1: :u-1:r1"})
    @DisplayName("실패: 형식이 잘못된 메시지는 IllegalArgumentException")
    void parse_Malformed(String message) {
        assertThrows(IllegalArgumentException.class, () -> ReactionEntryConsumer.parse(message));
    }

    @Test
    @DisplayName("성공: 정상 메시지는 리액션 응모로 처리된다")
    void consume_Success() {
        when(entryService.enterByReaction(any())).thenReturn(EntryResult.accepted("ok"));

        consumer.consume("guild-1:g-1:u-1:r1");

        ArgumentCaptor<EntryRequest> captor = ArgumentCaptor.forClass(EntryRequest.class);
        verify(entryService).enterByReaction(captor.capture());
        assertEquals("u-1", captor.getValue().userId());
    }

    @Test
    @DisplayName("성공: 응모가 거절되어도 예외 없이 다음 메시지로 넘어간다")
    void consume_Rejected() {
        when(entryService.enterByReaction(any()))
                .thenReturn(EntryResult.rejected(EntryRejection.ALREADY_ENTERED, "dup"));

        assertDoesNotThrow(() -> consumer.consume("guild-1:g-1:u-1:"));
    }

    @Test
    @DisplayName("실패: 형식 오류 메시지는 재시도 없이 건너뛴다")
    void consume_MalformedSkipped() {
        assertDoesNotThrow(() -> consumer.consume("broken-message"));
        verify(entryService, never()).enterByReaction(any());
    }

    @Test
    @DisplayName("실패: 시스템 오류는 재시도를 위해 다시 던진다")
    void consume_SystemErrorRethrown() {
        when(entryService.enterByReaction(any())).thenThrow(new IllegalStateException("storage down"));

        assertThrows(IllegalStateException.class, () -> consumer.consume("guild-1:g-1:u-1:"));
    }
}
