package com.example.giveaway_system.platform;

/**
 * 플랫폼 채널 참조. 메시지 전송이 가능한 채널인지 함께 표시합니다.
 */
public record ChannelRef(String id, String guildId, boolean sendable) {
}
