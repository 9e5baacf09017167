package com.example.giveaway_system.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 진행 중이거나 종료/취소된 경품 이벤트(Giveaway).
 * 워크스페이스(guild) 단위의 JSON 문서 안에 배열로 저장됩니다.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Giveaway {

    public static final int UNLIMITED_ATTEMPTS = -1;

    private final String id;
    private final String guildId;
    private String channelId;
    private String messageId;
    private final String title;

    // 경품 내용은 기밀 - 당첨자 본인 또는 관리자에게만 공개
    private final List<String> prizes;

    private final Instant startTime;
    private final Instant endTime;
    private final String creatorId;
    private final EntryMode entryMode;
    private final int winnerCount;

    private final Set<String> participants;
    private List<String> winners;
    private boolean ended;
    private boolean cancelled;

    private final String triviaQuestion;
    private final String triviaAnswer;
    private final int maxTriviaAttempts;
    private final String reactionIdentifier;
    private final String reactionDisplayEmoji;
    private final List<String> requiredRoles;
    private final List<String> blockedRoles;

    // 경쟁 모드: userId -> 0부터 시작하는 순위 (정답 도착 순서)
    private final Map<String, Integer> competitionPlacements;
    private final boolean liveLeaderboard;
    private final Set<String> claimedPrizes;
    private Map<String, String> prizeAssignments;

    @Jacksonized
    @Builder(toBuilder = true)
    public Giveaway(String id, String guildId, String channelId, String messageId, String title,
                    List<String> prizes, Instant startTime, Instant endTime, String creatorId,
                    EntryMode entryMode, int winnerCount, Collection<String> participants,
                    List<String> winners, boolean ended, boolean cancelled,
                    String triviaQuestion, String triviaAnswer, Integer maxTriviaAttempts,
                    String reactionIdentifier, String reactionDisplayEmoji,
                    List<String> requiredRoles, List<String> blockedRoles,
                    Map<String, Integer> competitionPlacements, Boolean liveLeaderboard,
                    Collection<String> claimedPrizes, Map<String, String> prizeAssignments) {

        if (id == null || id.isBlank() || guildId == null) {
            throw new IllegalArgumentException("Giveaway ID와 워크스페이스 ID는 필수값입니다.");
        }
        validatePeriod(startTime, endTime);
        validateWinnerCount(winnerCount);

        this.id = id;
        this.guildId = guildId;
        this.channelId = channelId;
        this.messageId = messageId;
        this.title = title;
        this.prizes = prizes == null ? new ArrayList<>() : new ArrayList<>(prizes);
        this.startTime = startTime;
        this.endTime = endTime;
        this.creatorId = creatorId;
        this.entryMode = entryMode == null ? EntryMode.BUTTON : entryMode;
        this.winnerCount = winnerCount;
        this.participants = participants == null ? new LinkedHashSet<>() : new LinkedHashSet<>(participants);
        this.winners = winners == null ? new ArrayList<>() : new ArrayList<>(winners);
        this.ended = ended || cancelled;
        this.cancelled = cancelled;
        this.triviaQuestion = triviaQuestion;
        this.triviaAnswer = triviaAnswer;
        // 0 또는 미설정은 무제한(-1)으로 정규화
        this.maxTriviaAttempts = (maxTriviaAttempts == null || maxTriviaAttempts <= 0)
                ? UNLIMITED_ATTEMPTS : maxTriviaAttempts;
        this.reactionIdentifier = reactionIdentifier;
        this.reactionDisplayEmoji = reactionDisplayEmoji;
        this.requiredRoles = requiredRoles == null ? new ArrayList<>() : new ArrayList<>(requiredRoles);
        this.blockedRoles = blockedRoles == null ? new ArrayList<>() : new ArrayList<>(blockedRoles);
        this.competitionPlacements = competitionPlacements == null
                ? new LinkedHashMap<>() : new LinkedHashMap<>(competitionPlacements);
        this.liveLeaderboard = liveLeaderboard == null || liveLeaderboard;
        this.claimedPrizes = claimedPrizes == null ? new LinkedHashSet<>() : new LinkedHashSet<>(claimedPrizes);
        this.prizeAssignments = prizeAssignments == null
                ? new LinkedHashMap<>() : new LinkedHashMap<>(prizeAssignments);

        if (this.winners.size() > winnerCount) {
            throw new IllegalArgumentException("당첨자 수가 설정된 당첨 인원을 초과할 수 없습니다.");
        }
    }

    /**
     * 캐시와 분리된 깊은 복사본을 만듭니다. (컬렉션은 생성자에서 새로 복사됨)
     */
    public Giveaway copy() {
        return toBuilder().build();
    }

    /**
     * 해당 시점에 응모가 가능한 상태인지 확인합니다.
     */
    public boolean isOpenAt(Instant now) {
        return !ended && !cancelled && endTime.isAfter(now);
    }

    public boolean hasParticipant(String userId) {
        return participants.contains(userId);
    }

    /**
     * 참여자를 추가합니다. 종료된 이벤트의 참여자 목록은 변경할 수 없습니다.
     * @return 새로 추가되었으면 true
     */
    public boolean addParticipant(String userId) {
        ensureNotEnded();
        return participants.add(userId);
    }

    /**
     * 외부(리액션 목록)에서 관측된 참여자를 병합합니다.
     * @return 새로 추가된 인원 수
     */
    public int mergeParticipants(Collection<String> userIds) {
        ensureNotEnded();
        int before = participants.size();
        participants.addAll(userIds);
        return participants.size() - before;
    }

    public int placementCount() {
        return competitionPlacements.size();
    }

    /**
     * [경쟁 모드] 정답 도착 순서대로 다음 순위를 배정합니다.
     * @return 배정된 0-based 순위
     */
    public int assignPlacement(String userId) {
        ensureNotEnded();
        if (competitionPlacements.containsKey(userId)) {
            throw new IllegalStateException("이미 순위가 배정된 참여자입니다. (userId: " + userId + ")");
        }
        if (placementCount() >= winnerCount) {
            throw new IllegalStateException("모든 순위가 이미 배정되었습니다. (giveawayId: " + id + ")");
        }
        int placement = placementCount();
        competitionPlacements.put(userId, placement);
        participants.add(userId);
        return placement;
    }

    /**
     * 순위 오름차순으로 정렬된 경쟁 모드 참여자 목록
     */
    public List<String> usersByPlacement() {
        return competitionPlacements.entrySet().stream()
                .sorted(Map.Entry.comparingByValue(Comparator.naturalOrder()))
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * 추첨 결과를 확정하며 종료 상태로 전이합니다.
     */
    public void markEnded(List<String> selectedWinners, Map<String, String> assignments) {
        ensureNotEnded();
        if (selectedWinners.size() > winnerCount) {
            throw new IllegalStateException("당첨자 수가 설정된 당첨 인원을 초과할 수 없습니다.");
        }
        this.winners = new ArrayList<>(selectedWinners);
        this.prizeAssignments = new LinkedHashMap<>(assignments);
        this.cancelled = false;
        this.ended = true;
    }

    /**
     * 이벤트를 취소합니다. 취소된 이벤트도 종료(ended)로 표시됩니다.
     */
    public void markCancelled() {
        if (cancelled) {
            throw new IllegalStateException("이미 취소된 이벤트입니다. (giveawayId: " + id + ")");
        }
        ensureNotEnded();
        this.cancelled = true;
        this.ended = true;
        this.winners = new ArrayList<>();
    }

    public boolean markClaimed(String userId) {
        return claimedPrizes.add(userId);
    }

    public void attachAnnouncement(String channelId, String messageId) {
        this.channelId = channelId;
        this.messageId = messageId;
    }

    public boolean isWinner(String userId) {
        return winners.contains(userId);
    }

    /**
     * 필수 역할 조건: 설정되어 있으면 하나 이상 보유해야 함
     */
    public boolean satisfiesRequiredRoles(Set<String> roleIds) {
        return requiredRoles.isEmpty() || requiredRoles.stream().anyMatch(roleIds::contains);
    }

    public boolean holdsBlockedRole(Set<String> roleIds) {
        return blockedRoles.stream().anyMatch(roleIds::contains);
    }

    public boolean hasAttemptLimit() {
        return maxTriviaAttempts != UNLIMITED_ATTEMPTS;
    }

    private void ensureNotEnded() {
        if (ended) {
            throw new IllegalStateException("이미 종료된 이벤트입니다. (giveawayId: " + id + ")");
        }
    }

    private void validatePeriod(Instant startTime, Instant endTime) {
        if (startTime == null || endTime == null) {
            throw new IllegalArgumentException("시작 시각과 종료 시각은 필수입니다.");
        }
        if (!endTime.isAfter(startTime)) {
            throw new IllegalArgumentException("종료 시각은 시작 시각보다 늦어야 합니다.");
        }
    }

    private void validateWinnerCount(int winnerCount) {
        if (winnerCount < 1) {
            throw new IllegalArgumentException("당첨 인원은 1명 이상이어야 합니다.");
        }
    }
}
