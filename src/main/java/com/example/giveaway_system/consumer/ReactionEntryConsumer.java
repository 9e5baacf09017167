package com.example.giveaway_system.consumer;

import com.example.giveaway_system.domain.EntryMode;
import com.example.giveaway_system.dto.EntryRequest;
import com.example.giveaway_system.dto.EntryResult;
import com.example.giveaway_system.service.GiveawayEntryService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class ReactionEntryConsumer {

    private final GiveawayEntryService entryService;

    /**
     * 리액션 응모 메시지를 수신하여 응모 처리합니다.
     * 형식: {@code guildId:giveawayId:userId:role1,role2} (역할이 없으면 마지막 항목은 비어 있음)
     */
    @KafkaListener(topics = "${giveaway.kafka.reaction-topic:giveaway-reaction-topic}",
            groupId = "${giveaway.kafka.group-id:giveaway-group}")
    public void consume(String message) {
        log.info("### Kafka 리액션 응모 수신: {}", message);

        try {
            EntryRequest request = parse(message);
            EntryResult result = entryService.enterByReaction(request);
            if (!result.accepted()) {
                log.info("### 리액션 응모 거절: giveaway={}, user={}, reason={}",
                        request.giveawayId(), request.userId(), result.rejection());
            }
        } catch (IllegalArgumentException e) {
            log.error("### 메시지 형식 오류(재시도 제외): {}, message: {}", e.getMessage(), message);
        } catch (Exception e) {
            log.error("### 리액션 응모 처리 중 시스템 오류 발생(재시도): {}, message: {}", e.getMessage(), message);
            // 예외를 다시 던져야 에러 핸들러가 재시도 후 DLT로 보냅니다.
            throw e;
        }
    }

    static EntryRequest parse(String message) {
        if (message == null) {
            throw new IllegalArgumentException("빈 메시지입니다.");
        }
        String[] data = message.split(":", -1);
        if (data.length != 4 || data[0].isBlank() || data[1].isBlank() || data[2].isBlank()) {
            throw new IllegalArgumentException("잘못된 메시지 형식입니다.");
        }
        Set<String> roleIds = Arrays.stream(data[3].split(","))
                .map(String::trim)
                .filter(role -> !role.isEmpty())
                .collect(Collectors.toSet());
        return new EntryRequest(data[0], data[1], data[2], roleIds, EntryMode.REACTION);
    }
}
