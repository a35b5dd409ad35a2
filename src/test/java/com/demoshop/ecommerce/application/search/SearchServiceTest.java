package com.demoshop.ecommerce.application.search;

import com.demoshop.ecommerce.application.product.dto.ProductResponse;
import com.demoshop.ecommerce.common.exception.ErrorCode;
import com.demoshop.ecommerce.common.exception.InvalidRequestException;
import com.demoshop.ecommerce.domain.search.SearchHistory;
import com.demoshop.ecommerce.domain.search.SearchHistoryRepository;
import com.demoshop.ecommerce.infrastructure.persistence.product.InMemoryProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SearchService 단위 테스트")
class SearchServiceTest {

    @Mock
    private SearchHistoryRepository searchHistoryRepository;

    private SearchService searchService;

    @BeforeEach
    void setup() {
        searchService = new SearchService(new InMemoryProductRepository(), searchHistoryRepository);
    }

    @Test
    @DisplayName("검색 - 이름/설명 부분 일치, 카탈로그 순서")
    void testSearch_MatchesInCatalogOrder() {
        List<ProductResponse> result = searchService.search("Pro", null);

        assertEquals(List.of("1", "2", "3"),
                result.stream().map(ProductResponse::getProductId).collect(Collectors.toList()));
        verifyNoInteractions(searchHistoryRepository);
    }

    @Test
    @DisplayName("검색 - 카테고리 일치")
    void testSearch_MatchesCategory() {
        assertEquals(5, searchService.search("Electronics", null).size());
    }

    @Test
    @DisplayName("검색 - 대소문자 구분")
    void testSearch_CaseSensitive() {
        assertTrue(searchService.search("macbook", null).isEmpty());
        assertEquals(1, searchService.search("MacBook", null).size());
    }

    @Test
    @DisplayName("검색 - user_id가 있으면 이력 기록")
    void testSearch_RecordsHistory() {
        searchService.search("iPad", "user-1");

        ArgumentCaptor<SearchHistory> captor = ArgumentCaptor.forClass(SearchHistory.class);
        verify(searchHistoryRepository).save(captor.capture());
        assertEquals("user-1", captor.getValue().getUserId());
        assertEquals("iPad", captor.getValue().getQuery());
        assertNotNull(captor.getValue().getSearchedAt());
    }

    @Test
    @DisplayName("검색 - 결과가 없어도 이력은 기록")
    void testSearch_NoResultStillRecorded() {
        List<ProductResponse> result = searchService.search("nothing-matches", "user-1");

        assertTrue(result.isEmpty());
        verify(searchHistoryRepository, times(1)).save(any(SearchHistory.class));
    }

    @Test
    @DisplayName("검색 실패 - 검색어 누락")
    void testSearch_MissingQuery() {
        InvalidRequestException exception = assertThrows(InvalidRequestException.class,
                () -> searchService.search("", "user-1"));

        assertEquals(ErrorCode.SEARCH_QUERY_REQUIRED, exception.getErrorCode());
        verifyNoInteractions(searchHistoryRepository);
    }

    @Test
    @DisplayName("검색 실패 - 검색어 null")
    void testSearch_NullQuery() {
        InvalidRequestException exception = assertThrows(InvalidRequestException.class,
                () -> searchService.search(null, null));

        assertEquals(ErrorCode.SEARCH_QUERY_REQUIRED, exception.getErrorCode());
    }

    @Test
    @DisplayName("검색 - 공백 검색어는 그대로 부분 일치에 사용")
    void testSearch_WhitespaceQueryIsLiteral() {
        List<ProductResponse> result = searchService.search(" ", "user-1");

        assertEquals(5, result.size());
        verify(searchHistoryRepository).save(any(SearchHistory.class));
    }
}
