package com.example.giveaway_system.service;

import com.example.giveaway_system.domain.Giveaway;
import com.example.giveaway_system.dto.ClaimResult;
import com.example.giveaway_system.dto.ClaimResult.Status;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 종료된 Giveaway의 경품 확인.
 * 당첨자는 자신의 경품만, 관리자와 생성자는 전체 경품과 당첨자를 볼 수 있습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PrizeClaimService {

    private static final String PRIZE_NOT_AVAILABLE = "Prize not available";

    private final GiveawayRecordStore recordStore;
    private final GiveawayCache cache;

    public ClaimResult claim(String workspaceId, String giveawayId, String userId, boolean administrator) {
        ReentrantLock lock = cache.eventLock(giveawayId);
        lock.lock();
        try {
            Optional<Giveaway> found = recordStore.get(giveawayId, workspaceId);
            if (found.isEmpty()) {
                return ClaimResult.of(Status.NOT_FOUND, "This giveaway could not be found.");
            }
            Giveaway giveaway = found.get();
            if (giveaway.isCancelled()) {
                return ClaimResult.of(Status.CANCELLED, "This giveaway was cancelled, so no prizes can be claimed.");
            }
            if (!giveaway.isEnded()) {
                return ClaimResult.of(Status.NOT_ENDED,
                        "This giveaway has not ended yet. Winners will be announced once it concludes.");
            }

            if (giveaway.isWinner(userId)) {
                return claimAsWinner(giveaway, workspaceId, userId);
            }
            if (administrator || userId.equals(giveaway.getCreatorId())) {
                return adminView(giveaway);
            }
            return ClaimResult.of(Status.NOT_WINNER, "Nice try! But you are not a winner of this giveaway... Maybe next time!");
        } finally {
            lock.unlock();
        }
    }

    private ClaimResult claimAsWinner(Giveaway giveaway, String workspaceId, String userId) {
        boolean previouslyClaimed = giveaway.getClaimedPrizes().contains(userId);
        String prize = prizeOf(giveaway, userId);

        if (!previouslyClaimed) {
            recordStore.update(giveaway.getId(), workspaceId, g -> g.markClaimed(userId));
            log.info("### 경품 수령: giveaway={}, user={}", giveaway.getId(), userId);
        }

        String message = "🎁 Congratulations! Your prize is: ||" + prize + "||"
                + (previouslyClaimed ? " (previously claimed)" : "");
        return new ClaimResult(Status.WINNER, message, List.of(prize), previouslyClaimed);
    }

    // 배정 정보가 없으면 당첨 순번의 경품으로 대체
    private String prizeOf(Giveaway giveaway, String userId) {
        String assigned = giveaway.getPrizeAssignments().get(userId);
        if (assigned != null && !assigned.isBlank()) {
            return assigned;
        }
        int winnerIndex = giveaway.getWinners().indexOf(userId);
        List<String> prizes = giveaway.getPrizes();
        if (winnerIndex < prizes.size() && prizes.get(winnerIndex) != null && !prizes.get(winnerIndex).isBlank()) {
            return prizes.get(winnerIndex);
        }
        return PRIZE_NOT_AVAILABLE;
    }

    private ClaimResult adminView(Giveaway giveaway) {
        String prizeInfo = giveaway.getPrizes().isEmpty()
                ? "No prizes set"
                : "||" + String.join(", ", giveaway.getPrizes()) + "||";
        String winnersText = giveaway.getWinners().isEmpty()
                ? "None"
                : giveaway.getWinners().stream().map(id -> "<@" + id + ">").collect(Collectors.joining(", "));

        return new ClaimResult(Status.ADMIN_VIEW,
                "You didn't win this one. As an admin/creator, you can see the prize details: "
                        + prizeInfo + ". Winners: " + winnersText + ".",
                List.copyOf(giveaway.getPrizes()), false);
    }
}
