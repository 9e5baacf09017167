package com.example.giveaway_system.service;

import com.example.giveaway_system.domain.EntryMode;
import com.example.giveaway_system.domain.Giveaway;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 공개 채널에 게시되는 안내 문구.
 * 경품 내용은 공개 메시지에 포함하지 않습니다.
 */
public final class GiveawayMessageFormatter {

    private GiveawayMessageFormatter() {
    }

    public static String placementText(int placement) {
        return switch (placement) {
            case 0 -> "🥇 1st";
            case 1 -> "🥈 2nd";
            case 2 -> "🥉 3rd";
            default -> "🎗️ " + (placement + 1) + "th";
        };
    }

    public static String placementEmoji(int placement) {
        return switch (placement) {
            case 0 -> "🥇";
            case 1 -> "🥈";
            case 2 -> "🥉";
            default -> "🎗️";
        };
    }

    public static String announcement(Giveaway giveaway) {
        StringBuilder sb = new StringBuilder()
                .append("🎉 **").append(giveaway.getTitle()).append("**\n")
                .append("Winners: ").append(giveaway.getWinnerCount()).append('\n')
                .append("Ends: <t:").append(giveaway.getEndTime().getEpochSecond()).append(":R>\n")
                .append(entryInstruction(giveaway));
        if (!giveaway.getRequiredRoles().isEmpty()) {
            sb.append("\nRequired roles: ").append(roleMentions(giveaway.getRequiredRoles()));
        }
        return sb.toString();
    }

    private static String entryInstruction(Giveaway giveaway) {
        return switch (giveaway.getEntryMode()) {
            case BUTTON -> "Click the button below to enter!";
            case REACTION -> "React with " + giveaway.getReactionDisplayEmoji() + " to enter!";
            case TRIVIA -> "Answer the question to enter: **" + giveaway.getTriviaQuestion() + "**";
            case COMPETITION -> "First correct answers win: **" + giveaway.getTriviaQuestion() + "**";
        };
    }

    /**
     * 종료 결과 메시지 (당첨자 멘션 포함)
     */
    public static String results(Giveaway giveaway) {
        StringBuilder sb = new StringBuilder()
                .append("🎊 **").append(giveaway.getTitle()).append("** has ended!\n");

        if (giveaway.getWinners().isEmpty()) {
            return sb.append("No valid participants, so no winners could be chosen.").toString();
        }

        List<String> winners = giveaway.getWinners();
        if (giveaway.getEntryMode() == EntryMode.COMPETITION) {
            for (String userId : winners) {
                int placement = giveaway.getCompetitionPlacements().getOrDefault(userId, winners.indexOf(userId));
                sb.append(placementEmoji(placement)).append(" <@").append(userId).append(">\n");
            }
        } else {
            sb.append("Winners: ").append(userMentions(winners)).append('\n');
        }
        return sb.append("Winners can claim their prize with the claim button.").toString();
    }

    public static String endedAnnouncement(Giveaway giveaway, String resultUrl) {
        return "🎉 **" + giveaway.getTitle() + "** (ended)\n"
                + "Participants: " + giveaway.getParticipants().size() + "\n"
                + "Results: " + resultUrl;
    }

    public static String cancelledAnnouncement(Giveaway giveaway) {
        return "🚫 **" + giveaway.getTitle() + "**\nThis giveaway has been cancelled.";
    }

    /**
     * 실시간 리더보드가 포함된 안내 메시지
     */
    public static String leaderboard(Giveaway giveaway) {
        StringBuilder sb = new StringBuilder(announcement(giveaway)).append("\n\n**Leaderboard**\n");
        List<String> ranked = giveaway.usersByPlacement();
        for (int i = 0; i < giveaway.getWinnerCount(); i++) {
            sb.append(placementText(i)).append(": ")
                    .append(i < ranked.size() ? "<@" + ranked.get(i) + ">" : "-")
                    .append('\n');
        }
        return sb.toString().stripTrailing();
    }

    private static String userMentions(List<String> userIds) {
        return userIds.stream().map(id -> "<@" + id + ">").collect(Collectors.joining(", "));
    }

    private static String roleMentions(List<String> roleIds) {
        return roleIds.stream().map(id -> "<@&" + id + ">").collect(Collectors.joining(", "));
    }
}
