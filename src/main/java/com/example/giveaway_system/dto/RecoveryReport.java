package com.example.giveaway_system.dto;

/**
 * 시작 시 복구 결과
 */
public record RecoveryReport(int scheduled, int processedImmediately) {}
