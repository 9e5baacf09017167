package com.example.giveaway_system.service.strategy;

import com.example.giveaway_system.domain.EntryMode;
import com.example.giveaway_system.domain.Giveaway;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * 버튼/리액션/퀴즈 모드: 참여자 중 무작위 추첨.
 * 참여자와 경품을 각각 독립적으로 섞은 뒤 같은 순번끼리 짝지어 배정합니다.
 */
@Slf4j
@Component
public class RandomDrawStrategy implements WinnerSelectionStrategy {

    @Override
    public List<EntryMode> getEntryModes() {
        return List.of(EntryMode.BUTTON, EntryMode.REACTION, EntryMode.TRIVIA);
    }

    @Override
    public WinnerSelection select(Giveaway giveaway, Predicate<String> resolvable) {
        if (giveaway.getParticipants().isEmpty()) {
            return WinnerSelection.none();
        }

        List<String> drawn = shuffle(new ArrayList<>(giveaway.getParticipants()));
        List<String> candidates = drawn.subList(0, Math.min(giveaway.getWinnerCount(), drawn.size()));
        List<String> prizes = shuffle(new ArrayList<>(giveaway.getPrizes()));

        List<String> winners = new ArrayList<>();
        Map<String, String> assignments = new LinkedHashMap<>();
        for (int i = 0; i < candidates.size(); i++) {
            String userId = candidates.get(i);
            // 조회 불가 사용자는 제외하고 다음 순번으로 채우지 않음
            if (!resolvable.test(userId)) {
                log.error("### 당첨자 조회 실패로 제외: giveaway={}, user={}", giveaway.getId(), userId);
                continue;
            }
            winners.add(userId);
            if (i < prizes.size() && prizes.get(i) != null) {
                assignments.put(userId, prizes.get(i));
            }
        }
        return new WinnerSelection(winners, assignments);
    }

    /**
     * Fisher-Yates 셔플. 모든 순열이 같은 확률로 나옵니다.
     */
    static <T> List<T> shuffle(List<T> items) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = items.size() - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            T tmp = items.get(i);
            items.set(i, items.get(j));
            items.set(j, tmp);
        }
        return items;
    }
}
