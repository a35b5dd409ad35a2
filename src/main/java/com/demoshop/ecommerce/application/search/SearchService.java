package com.demoshop.ecommerce.application.search;

import com.demoshop.ecommerce.application.product.dto.ProductResponse;
import com.demoshop.ecommerce.common.exception.ErrorCode;
import com.demoshop.ecommerce.common.exception.InvalidRequestException;
import com.demoshop.ecommerce.domain.product.ProductRepository;
import com.demoshop.ecommerce.domain.search.SearchHistory;
import com.demoshop.ecommerce.domain.search.SearchHistoryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * SearchService - 상품 검색 및 검색 이력 기록 (Application 계층)
 *
 * 비즈니스 규칙:
 * - 검색어는 필수 (비어 있으면 ValidationError)
 * - user_id가 있으면 검색 이력을 먼저 기록하고, 없으면 기록하지 않음
 * - 매칭은 상품명/설명/카테고리에 대한 대소문자 구분 부분 문자열 포함 여부
 */
@Slf4j
@Service
public class SearchService {

    private final ProductRepository productRepository;
    private final SearchHistoryRepository searchHistoryRepository;

    public SearchService(ProductRepository productRepository,
                         SearchHistoryRepository searchHistoryRepository) {
        this.productRepository = productRepository;
        this.searchHistoryRepository = searchHistoryRepository;
    }

    public List<ProductResponse> search(String query, String userId) {
        if (query == null || query.isEmpty()) {
            throw new InvalidRequestException(ErrorCode.SEARCH_QUERY_REQUIRED);
        }

        if (userId != null && !userId.isBlank()) {
            searchHistoryRepository.save(SearchHistory.record(userId, query, LocalDateTime.now()));
            log.info("[SearchService] 검색 이력 기록: userId={}, query={}", userId, query);
        }

        return productRepository.findAll().stream()
                .filter(product -> product.matches(query))
                .map(ProductResponse::from)
                .collect(Collectors.toList());
    }
}
