package com.example.giveaway_system.consumer;

import com.example.giveaway_system.config.GiveawayProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

/**
 * 리액션 응모 토픽 전용 컨슈머 설정.
 */
@Slf4j
@EnableKafka
@Configuration
@RequiredArgsConstructor
public class KafkaConsumerConfig {

    static final long RETRY_INTERVAL_MS = 1000L;
    static final long MAX_RETRIES = 2L;

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final GiveawayProperties properties;

    /**
     * 응모 저장 실패 같은 일시 장애는 1초 간격으로 2회 재시도합니다.
     * 그래도 실패한 메시지는 같은 파티션 번호로 리액션 토픽의 DLT에 보내 giveaway 키 순서를 유지합니다.
     */
    @Bean
    public DefaultErrorHandler reactionEntryErrorHandler() {
        String deadLetterTopic = properties.kafka().deadLetterTopic();
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(kafkaTemplate,
                (record, ex) -> {
                    TopicPartition destination = deadLetterPartition(record, deadLetterTopic);
                    log.error("### [DLT 전송] 리액션 응모 처리 실패: giveaway={}, partition={}, dlt={}, error={}",
                            record.key(), record.partition(), destination.topic(), ex.getMessage());
                    return destination;
                });

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer,
                new FixedBackOff(RETRY_INTERVAL_MS, MAX_RETRIES));
        // 형식 오류는 재시도해도 소용없음
        errorHandler.addNotRetryableExceptions(IllegalArgumentException.class);
        return errorHandler;
    }

    // DLT는 원본과 같은 파티션 수로 만들어져 있어야 함
    static TopicPartition deadLetterPartition(ConsumerRecord<?, ?> record, String deadLetterTopic) {
        return new TopicPartition(deadLetterTopic, record.partition());
    }
}
