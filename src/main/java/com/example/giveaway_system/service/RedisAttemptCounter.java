package com.example.giveaway_system.service;

import com.example.giveaway_system.domain.Giveaway;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;

/**
 * 퀴즈/경쟁 모드의 사용자별 답변 시도 횟수 카운터.
 * Redis 장애 시에는 시도 기록이 없는 것으로 간주하여 응모를 막지 않습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedisAttemptCounter {

    private static final String KEY_PREFIX = "giveaway:attempts:";
    private static final Duration RETENTION_AFTER_END = Duration.ofDays(1);

    private final StringRedisTemplate redisTemplate;

    public int getAttempts(Giveaway giveaway, String userId) {
        try {
            String value = redisTemplate.opsForValue().get(key(giveaway.getId(), userId));
            return value == null ? 0 : Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("### 잘못된 시도 횟수 값 - 0으로 간주: giveaway={}, user={}", giveaway.getId(), userId);
            return 0;
        } catch (Exception e) {
            log.error("### Redis 장애 - 시도 횟수 조회 생략: giveaway={}, user={}, error={}",
                    giveaway.getId(), userId, e.getMessage());
            return 0;
        }
    }

    /**
     * 오답 1회를 기록합니다. INCR 연산은 원자적으로 동작합니다.
     * @return 누적 시도 횟수 (Redis 장애 시 0)
     */
    public int increment(Giveaway giveaway, String userId) {
        String key = key(giveaway.getId(), userId);
        try {
            Long count = redisTemplate.opsForValue().increment(key);
            if (count != null && count == 1) {
                // 첫 오답일 때 만료 시각 설정 (종료 후 하루)
                redisTemplate.expireAt(key, giveaway.getEndTime().plus(RETENTION_AFTER_END));
            }
            return count == null ? 0 : count.intValue();
        } catch (Exception e) {
            log.error("### Redis 장애 - 시도 횟수 기록 생략: giveaway={}, user={}, error={}",
                    giveaway.getId(), userId, e.getMessage());
            return 0;
        }
    }

    private String key(String giveawayId, String userId) {
        return KEY_PREFIX + Objects.requireNonNull(giveawayId) + ":" + Objects.requireNonNull(userId);
    }
}
