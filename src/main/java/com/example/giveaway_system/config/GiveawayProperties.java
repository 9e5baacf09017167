package com.example.giveaway_system.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "giveaway")
public record GiveawayProperties(
        @DefaultValue("giveaway") String moduleNamespace,
        @DefaultValue Scheduler scheduler,
        @DefaultValue Kafka kafka
) {

    /**
     * @param maxTimerDelay 한 번에 예약 가능한 최대 지연 (기본 2147483647ms, 약 24.8일)
     */
    public record Scheduler(
            @DefaultValue("2147483647ms") Duration maxTimerDelay,
            @DefaultValue("4") int poolSize
    ) {
        public Scheduler {
            if (maxTimerDelay.isNegative() || maxTimerDelay.isZero()) {
                throw new IllegalArgumentException("max-timer-delay는 0보다 커야 합니다.");
            }
        }
    }

    public record Kafka(
            @DefaultValue("giveaway-reaction-topic") String reactionTopic,
            @DefaultValue("giveaway-group") String groupId
    ) {
        /**
         * 재시도 후에도 처리하지 못한 리액션 응모 메시지가 쌓이는 토픽
         */
        public String deadLetterTopic() {
            return reactionTopic + ".DLT";
        }
    }

    public static GiveawayProperties defaults() {
        return new GiveawayProperties("giveaway",
                new Scheduler(Duration.ofMillis(Integer.MAX_VALUE), 4),
                new Kafka("giveaway-reaction-topic", "giveaway-group"));
    }
}
