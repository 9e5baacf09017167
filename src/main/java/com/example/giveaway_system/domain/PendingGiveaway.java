package com.example.giveaway_system.domain;

import com.example.giveaway_system.domain.vo.GiveawayDuration;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 생성 패널에서 편집 중인 Giveaway 초안.
 * 시작(start) 시 {@link Giveaway}로 승격되고 삭제됩니다.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PendingGiveaway {

    public static final String DEFAULT_TITLE = "Untitled Giveaway";
    public static final long DEFAULT_DURATION_MS = 3_600_000L;

    private String id;
    private String guildId;
    private String createdBy;
    private Instant createdAt;

    @Builder.Default
    private String title = DEFAULT_TITLE;
    @Builder.Default
    private List<String> prizes = new ArrayList<>();
    @Builder.Default
    private long durationMs = DEFAULT_DURATION_MS;
    @Builder.Default
    private int winnerCount = 1;
    @Builder.Default
    private EntryMode entryMode = EntryMode.BUTTON;

    private String triviaQuestion;
    private String triviaAnswer;
    private Integer maxTriviaAttempts;

    private String reactionIdentifier;
    private String reactionDisplayEmoji;
    private String reactionEmojiInput;

    @Builder.Default
    private List<String> requiredRoles = new ArrayList<>();
    @Builder.Default
    private List<String> blockedRoles = new ArrayList<>();
    @Builder.Default
    private boolean liveLeaderboard = true;

    // 관리자가 수동으로 ready 지정한 경우
    private boolean statusPinned;

    public static PendingGiveaway draft(String id, String guildId, String createdBy, Instant createdAt) {
        return PendingGiveaway.builder()
                .id(id)
                .guildId(guildId)
                .createdBy(createdBy)
                .createdAt(createdAt)
                .build();
    }

    /**
     * 상태는 저장하지 않고 항상 현재 필드로부터 계산합니다.
     * JSON에는 참고용으로 기록되지만 읽을 때는 무시됩니다.
     */
    @JsonProperty(value = "status", access = JsonProperty.Access.READ_ONLY)
    public PendingStatus getStatus() {
        return isReadyToStart() ? PendingStatus.READY : PendingStatus.DRAFT;
    }

    /**
     * 목록의 READY 상태와 시작 가능 여부는 항상 같은 판단을 따릅니다.
     */
    @JsonIgnore
    public boolean isReadyToStart() {
        return validateForStart().isEmpty();
    }

    /**
     * 시작에 필요한 항목 중 처음으로 누락된 항목의 안내 메시지를 반환합니다.
     * 수동으로 ready 지정된 초안은 제목과 경품 확인을 건너뛰지만
     * 기간, 당첨 인원, 응모 방식별 필수 항목은 그대로 검사합니다.
     */
    public Optional<String> validateForStart() {
        if (!statusPinned && (title == null || title.isBlank() || DEFAULT_TITLE.equals(title))) {
            return Optional.of("Please set a title for the giveaway.");
        }
        if (durationMs <= 0 || durationMs > GiveawayDuration.MAX_DURATION.toMillis()) {
            return Optional.of("Please set a valid duration for the giveaway.");
        }
        if (winnerCount <= 0) {
            return Optional.of("Please set a valid number of winners.");
        }
        if (!statusPinned && configuredPrizeCount() < winnerCount) {
            return Optional.of(winnerCount == 1
                    ? "Please set a prize description."
                    : "Please configure all " + winnerCount + " prizes.");
        }
        if (entryMode.requiresQuestion()) {
            if (isBlank(triviaQuestion)) {
                return Optional.of("For " + entryMode.getLabel() + " mode, please set a trivia question.");
            }
            if (isBlank(triviaAnswer)) {
                return Optional.of("For " + entryMode.getLabel() + " mode, please set a trivia answer.");
            }
        }
        if (entryMode == EntryMode.REACTION && (isBlank(reactionIdentifier) || isBlank(reactionDisplayEmoji))) {
            return Optional.of("For reaction mode, please set a reaction emoji.");
        }
        return Optional.empty();
    }

    // 당첨 인원 수만큼의 슬롯이 모두 채워져 있어야 함
    private int configuredPrizeCount() {
        int count = 0;
        for (int i = 0; i < winnerCount && i < prizes.size(); i++) {
            if (!isBlank(prizes.get(i))) {
                count++;
            }
        }
        return count;
    }

    public PendingGiveaway copy() {
        return toBuilder()
                .prizes(new ArrayList<>(prizes))
                .requiredRoles(new ArrayList<>(requiredRoles))
                .blockedRoles(new ArrayList<>(blockedRoles))
                .build();
    }

    /**
     * 초안을 실제 Giveaway로 변환합니다.
     */
    public Giveaway toGiveaway(String giveawayId, String channelId, String messageId, Instant now) {
        return Giveaway.builder()
                .id(giveawayId)
                .guildId(guildId)
                .channelId(channelId)
                .messageId(messageId)
                .title(title)
                .prizes(new ArrayList<>(prizes.subList(0, Math.min(winnerCount, prizes.size()))))
                .startTime(now)
                .endTime(now.plusMillis(durationMs))
                .creatorId(createdBy)
                .entryMode(entryMode)
                .winnerCount(winnerCount)
                .triviaQuestion(triviaQuestion)
                .triviaAnswer(triviaAnswer)
                .maxTriviaAttempts(maxTriviaAttempts)
                .reactionIdentifier(reactionIdentifier)
                .reactionDisplayEmoji(reactionDisplayEmoji)
                .requiredRoles(requiredRoles)
                .blockedRoles(blockedRoles)
                .liveLeaderboard(liveLeaderboard)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
