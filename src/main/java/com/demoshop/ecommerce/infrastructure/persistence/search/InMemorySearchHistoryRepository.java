package com.demoshop.ecommerce.infrastructure.persistence.search;

import com.demoshop.ecommerce.domain.search.SearchHistory;
import com.demoshop.ecommerce.domain.search.SearchHistoryRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * InMemory SearchHistory Repository 구현
 * 사용자별 검색 이력을 기록 순서대로 보관한다.
 */
@Repository
public class InMemorySearchHistoryRepository implements SearchHistoryRepository {

    private final ConcurrentHashMap<String, List<SearchHistory>> histories = new ConcurrentHashMap<>();

    @Override
    public SearchHistory save(SearchHistory searchHistory) {
        histories.computeIfAbsent(searchHistory.getUserId(), id -> new CopyOnWriteArrayList<>())
                .add(searchHistory);
        return searchHistory;
    }

    @Override
    public List<SearchHistory> findByUserId(String userId) {
        return new ArrayList<>(histories.getOrDefault(userId, List.of()));
    }

    /**
     * 테스트용: 모든 검색 이력 삭제
     */
    public void clear() {
        histories.clear();
    }
}
