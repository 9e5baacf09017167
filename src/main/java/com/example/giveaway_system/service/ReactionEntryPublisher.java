package com.example.giveaway_system.service;

import com.example.giveaway_system.config.GiveawayProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * 리액션 응모를 Kafka 대기열로 발행합니다.
 * 메시지 형식: {@code guildId:giveawayId:userId:role1,role2}
 * 같은 Giveaway의 응모 순서를 보장하기 위해 giveawayId를 키로 사용합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReactionEntryPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final GiveawayProperties properties;

    public void publish(String guildId, String giveawayId, String userId, Set<String> roleIds) {
        String message = guildId + ":" + giveawayId + ":" + userId + ":" + String.join(",", roleIds);
        try {
            kafkaTemplate.send(properties.kafka().reactionTopic(), giveawayId, message);
        } catch (Exception e) {
            // 누락된 리액션은 종료 시 참여자 동기화로 복구됨
            log.error("### 리액션 응모 발행 실패: giveaway={}, user={}, error={}", giveawayId, userId, e.getMessage());
        }
    }
}
