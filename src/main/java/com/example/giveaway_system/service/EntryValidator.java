package com.example.giveaway_system.service;

import com.example.giveaway_system.domain.EntryMode;
import com.example.giveaway_system.domain.Giveaway;
import com.example.giveaway_system.dto.EntryRequest;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * 응모 가능 여부 검증. 상태를 변경하지 않으며 처음 실패한 항목에서 중단합니다.
 */
@Component
@RequiredArgsConstructor
public class EntryValidator {

    private final GiveawayRecordStore recordStore;
    private final RedisAttemptCounter attemptCounter;
    private final Clock clock;

    public EntryValidation validate(EntryRequest request) {
        Optional<Giveaway> found = recordStore.get(request.giveawayId(), request.guildId());
        if (found.isEmpty()) {
            return EntryValidation.rejected(EntryRejection.NOT_FOUND);
        }
        Giveaway giveaway = found.get();

        if (request.expectedMode() != null && giveaway.getEntryMode() != request.expectedMode()) {
            return EntryValidation.rejected(EntryRejection.WRONG_MODE, request.expectedMode().getLabel());
        }
        if (!giveaway.isOpenAt(clock.instant())) {
            return EntryValidation.rejected(EntryRejection.NOT_ACTIVE);
        }
        if (!giveaway.satisfiesRequiredRoles(request.roleIds())) {
            return EntryValidation.rejected(EntryRejection.MISSING_REQUIRED_ROLE);
        }
        if (giveaway.holdsBlockedRole(request.roleIds())) {
            return EntryValidation.rejected(EntryRejection.BLOCKED_ROLE);
        }

        if (giveaway.getEntryMode() == EntryMode.COMPETITION) {
            if (giveaway.placementCount() >= giveaway.getWinnerCount()) {
                return EntryValidation.rejected(EntryRejection.COMPETITION_FULL);
            }
            Integer placement = giveaway.getCompetitionPlacements().get(request.userId());
            if (placement != null) {
                return EntryValidation.rejected(EntryRejection.ALREADY_PLACED,
                        GiveawayMessageFormatter.placementText(placement));
            }
        }

        if (giveaway.getEntryMode().isAttemptLimited() && giveaway.hasAttemptLimit()) {
            int attempts = attemptCounter.getAttempts(giveaway, request.userId());
            if (attempts >= giveaway.getMaxTriviaAttempts()) {
                return EntryValidation.rejected(EntryRejection.ATTEMPTS_EXHAUSTED, giveaway.getMaxTriviaAttempts());
            }
        }

        if (giveaway.getEntryMode() != EntryMode.COMPETITION && giveaway.hasParticipant(request.userId())) {
            return EntryValidation.rejected(giveaway.getEntryMode() == EntryMode.TRIVIA
                    ? EntryRejection.ALREADY_ANSWERED
                    : EntryRejection.ALREADY_ENTERED);
        }

        return EntryValidation.passed(giveaway);
    }
}
