package com.demoshop.ecommerce.domain.search;

import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * SearchHistory - 사용자 검색 이력 (추가 전용)
 * 추천 신호로만 사용된다.
 */
@Getter
@Builder
public class SearchHistory {

    private final String searchId;

    private final String userId;

    private final String query;

    private final LocalDateTime searchedAt;

    public static SearchHistory record(String userId, String query, LocalDateTime now) {
        return SearchHistory.builder()
                .searchId(UUID.randomUUID().toString())
                .userId(userId)
                .query(query)
                .searchedAt(now)
                .build();
    }
}
