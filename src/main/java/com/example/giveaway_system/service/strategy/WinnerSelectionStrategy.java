package com.example.giveaway_system.service.strategy;

import com.example.giveaway_system.domain.EntryMode;
import com.example.giveaway_system.domain.Giveaway;

import java.util.List;
import java.util.function.Predicate;

public interface WinnerSelectionStrategy {
    /**
     * 이 전략이 처리하는 응모 방식 목록
     */
    List<EntryMode> getEntryModes();

    /**
     * 당첨자 선정 및 경품 배정
     * @param giveaway 참여자 동기화가 끝난 레코드
     * @param resolvable 플랫폼에서 조회 가능한 사용자인지 판별 (조회 불가 사용자는 제외)
     */
    WinnerSelection select(Giveaway giveaway, Predicate<String> resolvable);
}
