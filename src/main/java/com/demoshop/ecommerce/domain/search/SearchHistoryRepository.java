package com.demoshop.ecommerce.domain.search;

import java.util.List;

/**
 * SearchHistory Repository Interface (Domain Layer - Port)
 */
public interface SearchHistoryRepository {

    SearchHistory save(SearchHistory searchHistory);

    /**
     * 사용자의 검색 이력 (기록 순서)
     */
    List<SearchHistory> findByUserId(String userId);
}
