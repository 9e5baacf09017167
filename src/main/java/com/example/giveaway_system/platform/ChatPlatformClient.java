package com.example.giveaway_system.platform;

import java.time.Instant;
import java.util.List;

/**
 * 채팅 플랫폼 연동 클라이언트.
 * 모든 메서드는 실패 시 {@link ChatPlatformException}을 던집니다.
 */
public interface ChatPlatformClient {

    ChannelRef fetchChannel(String guildId, String channelId);

    boolean messageExists(String channelId, String messageId);

    SentMessage sendMessage(String channelId, String content);

    void editMessage(String channelId, String messageId, String content);

    void addReaction(String channelId, String messageId, String reaction);

    void removeAllReactions(String channelId, String messageId);

    /**
     * 메시지에 해당 리액션을 남긴 사용자 전체 (봇 포함)
     */
    List<PlatformUser> fetchReactionUsers(String channelId, String messageId, String reaction);

    PlatformUser fetchUser(String userId);

    /**
     * 리액션 추가 이벤트 구독. expiresAt 이후에는 플랫폼이 자동 해제합니다.
     */
    void registerReactionObserver(String messageId, String reaction, ReactionObserver observer, Instant expiresAt);

    void unregisterReactionObserver(String messageId);
}
