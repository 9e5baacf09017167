package com.example.giveaway_system.event;

/**
 * 채팅 플랫폼 연결이 준비되었음을 알리는 이벤트 (시작 시 1회)
 */
public record ChatPlatformReadyEvent() {}
