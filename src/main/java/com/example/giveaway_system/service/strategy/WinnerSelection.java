package com.example.giveaway_system.service.strategy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 추첨 결과: 순서가 있는 당첨자 목록과 당첨자별 경품
 */
public record WinnerSelection(List<String> winners, Map<String, String> prizeAssignments) {

    public WinnerSelection {
        winners = List.copyOf(winners);
        prizeAssignments = Collections.unmodifiableMap(new LinkedHashMap<>(prizeAssignments));
    }

    public static WinnerSelection none() {
        return new WinnerSelection(List.of(), Map.of());
    }
}
