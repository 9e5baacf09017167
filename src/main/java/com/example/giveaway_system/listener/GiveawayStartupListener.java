package com.example.giveaway_system.listener;

import com.example.giveaway_system.dto.RecoveryReport;
import com.example.giveaway_system.event.ChatPlatformReadyEvent;
import com.example.giveaway_system.service.GiveawayScheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Component
@RequiredArgsConstructor
public class GiveawayStartupListener {

    private final GiveawayScheduler scheduler;
    private final AtomicBoolean recovered = new AtomicBoolean(false);

    // 플랫폼 연결 준비 후 1회만 진행 중 Giveaway 복구
    @EventListener
    public void handlePlatformReady(ChatPlatformReadyEvent event) {
        if (!recovered.compareAndSet(false, true)) {
            log.info("### 이미 복구가 수행되어 건너뜀");
            return;
        }
        RecoveryReport report = scheduler.scheduleExisting();
        log.info("### 시작 복구 결과: 예약 {}건, 즉시 종료 {}건", report.scheduled(), report.processedImmediately());
    }
}
