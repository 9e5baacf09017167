package com.example.giveaway_system.service.strategy;

import com.example.giveaway_system.domain.EntryMode;
import com.example.giveaway_system.domain.Giveaway;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * 경쟁 모드: 정답 순위가 곧 당첨 순서이며, 순위 번호의 경품을 받습니다.
 */
@Slf4j
@Component
public class CompetitionPlacementStrategy implements WinnerSelectionStrategy {

    @Override
    public List<EntryMode> getEntryModes() {
        return List.of(EntryMode.COMPETITION);
    }

    @Override
    public WinnerSelection select(Giveaway giveaway, Predicate<String> resolvable) {
        List<String> winners = new ArrayList<>();
        Map<String, String> assignments = new LinkedHashMap<>();
        List<String> prizes = giveaway.getPrizes();

        for (String userId : giveaway.usersByPlacement()) {
            if (!resolvable.test(userId)) {
                log.error("### 경쟁 모드 당첨자 조회 실패로 제외: giveaway={}, user={}", giveaway.getId(), userId);
                continue;
            }
            winners.add(userId);
            int placement = giveaway.getCompetitionPlacements().get(userId);
            if (placement < prizes.size() && prizes.get(placement) != null) {
                assignments.put(userId, prizes.get(placement));
            }
        }
        return new WinnerSelection(winners, assignments);
    }
}
