package com.example.giveaway_system.service.strategy;

import com.example.giveaway_system.domain.EntryMode;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class WinnerSelectionStrategyFactory {

    private final Map<EntryMode, WinnerSelectionStrategy> strategies = new EnumMap<>(EntryMode.class);

    // WinnerSelectionStrategy를 구현한 모든 Bean을 주입받아 응모 방식별로 등록
    public WinnerSelectionStrategyFactory(List<WinnerSelectionStrategy> strategyList) {
        for (WinnerSelectionStrategy strategy : strategyList) {
            for (EntryMode mode : strategy.getEntryModes()) {
                strategies.put(mode, strategy);
            }
        }
    }

    public WinnerSelectionStrategy getStrategy(EntryMode mode) {
        return Optional.ofNullable(strategies.get(mode))
                .orElseThrow(() -> new IllegalArgumentException("지원하지 않는 추첨 방식입니다: " + mode));
    }
}
