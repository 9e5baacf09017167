package com.example.giveaway_system.consumer;

import com.example.giveaway_system.config.GiveawayProperties;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.DefaultErrorHandler;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class KafkaConsumerConfigTest {

    @Test
    @DisplayName("성공: 처리에 실패한 리액션 응모는 같은 파티션 번호로 리액션 토픽의 DLT에 보낸다")
    void deadLetterPartition_ReactionTopic() {
        GiveawayProperties properties = GiveawayProperties.defaults();
        ConsumerRecord<String, String> record =
                new ConsumerRecord<>("giveaway-reaction-topic", 3, 42L, "g-1", "guild-1:g-1:u-1:");

        TopicPartition destination =
                KafkaConsumerConfig.deadLetterPartition(record, properties.kafka().deadLetterTopic());

        assertEquals("giveaway-reaction-topic.DLT", destination.topic());
        assertEquals(3, destination.partition());
    }

    @Test
    @DisplayName("성공: 리액션 토픽 이름을 바꾸면 DLT 이름도 따라간다")
    void deadLetterTopic_FollowsReactionTopic() {
        GiveawayProperties properties = new GiveawayProperties("giveaway",
                new GiveawayProperties.Scheduler(Duration.ofMinutes(1), 1),
                new GiveawayProperties.Kafka("prod-reactions", "prod-group"));

        assertEquals("prod-reactions.DLT", properties.kafka().deadLetterTopic());
    }

    @Test
    @DisplayName("실패: 메시지 형식 오류는 재시도하지 않고 일시 장애만 재시도한다")
    @SuppressWarnings("unchecked")
    void errorHandler_RetryClassification() {
        KafkaConsumerConfig config = new KafkaConsumerConfig(mock(KafkaTemplate.class), GiveawayProperties.defaults());

        DefaultErrorHandler errorHandler = config.reactionEntryErrorHandler();

        assertFalse(errorHandler.removeClassification(IllegalArgumentException.class));
        assertNull(errorHandler.removeClassification(IllegalStateException.class));
    }
}
