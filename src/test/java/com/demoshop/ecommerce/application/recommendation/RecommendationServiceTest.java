package com.demoshop.ecommerce.application.recommendation;

import com.demoshop.ecommerce.application.product.dto.ProductResponse;
import com.demoshop.ecommerce.application.recommendation.strategy.OrderHistoryRecommendationStrategy;
import com.demoshop.ecommerce.application.recommendation.strategy.PopularityRecommendationStrategy;
import com.demoshop.ecommerce.application.recommendation.strategy.SearchHistoryRecommendationStrategy;
import com.demoshop.ecommerce.common.exception.ErrorCode;
import com.demoshop.ecommerce.common.exception.InvalidRequestException;
import com.demoshop.ecommerce.domain.cart.Cart;
import com.demoshop.ecommerce.domain.order.Order;
import com.demoshop.ecommerce.domain.product.Product;
import com.demoshop.ecommerce.domain.search.SearchHistory;
import com.demoshop.ecommerce.infrastructure.config.DemoShopProperties;
import com.demoshop.ecommerce.infrastructure.persistence.order.InMemoryOrderRepository;
import com.demoshop.ecommerce.infrastructure.persistence.product.InMemoryProductRepository;
import com.demoshop.ecommerce.infrastructure.persistence.search.InMemorySearchHistoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RecommendationServiceTest - 3단계 fallback 추천 테스트
 *
 * 카탈로그 (삽입 순서):
 * - b1 Java Book (Books, 4.1)
 * - e1 Phone Pro (Electronics, 4.9)
 * - b2 Kotlin Book (Books, 4.3)
 * - e2 Laptop Pro (Electronics, 4.7)
 * - g1 Garden Hose (Garden, 3.0)
 */
@DisplayName("RecommendationService 단위 테스트")
class RecommendationServiceTest {

    private static final String TEST_USER_ID = "user-1";

    private InMemoryOrderRepository orderRepository;
    private InMemorySearchHistoryRepository searchHistoryRepository;
    private RecommendationService recommendationService;

    @BeforeEach
    void setup() {
        InMemoryProductRepository productRepository = new InMemoryProductRepository();
        productRepository.clear();
        productRepository.save(product("b1", "Java Book", "Learn Java", "Books", 4.1));
        productRepository.save(product("e1", "Phone Pro", "A phone", "Electronics", 4.9));
        productRepository.save(product("b2", "Kotlin Book", "Learn Kotlin", "Books", 4.3));
        productRepository.save(product("e2", "Laptop Pro", "A laptop", "Electronics", 4.7));
        productRepository.save(product("g1", "Garden Hose", "Water plants", "Garden", 3.0));

        orderRepository = new InMemoryOrderRepository();
        searchHistoryRepository = new InMemorySearchHistoryRepository();

        // 순서를 섞어서 주입해도 getOrder() 순으로 실행되어야 한다
        recommendationService = new RecommendationService(productRepository,
                List.of(new PopularityRecommendationStrategy(),
                        new SearchHistoryRecommendationStrategy(searchHistoryRepository),
                        new OrderHistoryRecommendationStrategy(orderRepository)),
                new DemoShopProperties());
    }

    private static Product product(String id, String name, String description, String category, double rating) {
        return Product.createProduct(id, name, description, new BigDecimal("10.00"), category, 10, rating, "");
    }

    private void placeOrder(String userId, String productId) {
        Cart cart = Cart.createFor(userId, LocalDateTime.now());
        cart.addItem(productId, 1);
        orderRepository.save(Order.completeFrom(cart, LocalDateTime.now()));
    }

    private void recordSearch(String userId, String query) {
        searchHistoryRepository.save(SearchHistory.record(userId, query, LocalDateTime.now()));
    }

    private List<String> ids(List<ProductResponse> products) {
        return products.stream().map(ProductResponse::getProductId).collect(Collectors.toList());
    }

    @Test
    @DisplayName("이력 없음 - 인기 상품 (평점 내림차순)")
    void testRecommend_PopularityFallback() {
        List<ProductResponse> result = recommendationService.getRecommendations(TEST_USER_ID, 3);

        assertEquals(List.of("e1", "e2", "b2"), ids(result));
    }

    @Test
    @DisplayName("주문 이력 - 주문한 카테고리 상품을 카탈로그 순서로 (구매한 상품 포함)")
    void testRecommend_OrderHistoryTier() {
        placeOrder(TEST_USER_ID, "b2");
        recordSearch(TEST_USER_ID, "Phone");

        List<ProductResponse> result = recommendationService.getRecommendations(TEST_USER_ID, 5);

        assertEquals(List.of("b1", "b2"), ids(result));
    }

    @Test
    @DisplayName("주문 이력 - 여러 카테고리, limit 적용")
    void testRecommend_OrderHistoryTierWithLimit() {
        placeOrder(TEST_USER_ID, "e1");
        placeOrder(TEST_USER_ID, "g1");

        List<ProductResponse> result = recommendationService.getRecommendations(TEST_USER_ID, 2);

        assertEquals(List.of("e1", "e2"), ids(result));
    }

    @Test
    @DisplayName("주문 상품이 카탈로그에 없으면 검색 이력 단계로 fallback")
    void testRecommend_OrderOfUnknownProductFallsThrough() {
        placeOrder(TEST_USER_ID, "discontinued");
        recordSearch(TEST_USER_ID, "Hose");

        List<ProductResponse> result = recommendationService.getRecommendations(TEST_USER_ID, 5);

        assertEquals(List.of("g1"), ids(result));
    }

    @Test
    @DisplayName("검색 이력 - 검색 순서대로, 여러 검색어에 걸린 상품은 반복")
    void testRecommend_SearchHistoryTier() {
        recordSearch(TEST_USER_ID, "Learn");
        recordSearch(TEST_USER_ID, "Pro");
        recordSearch(TEST_USER_ID, "Kotlin");

        List<ProductResponse> result = recommendationService.getRecommendations(TEST_USER_ID, 10);

        assertEquals(List.of("b1", "b2", "e1", "e2", "b2"), ids(result));
    }

    @Test
    @DisplayName("검색 이력 - 같은 검색어를 두 번 기록하면 같은 상품이 두 번 추천됨")
    void testRecommend_SearchHistoryRepeatedQuery() {
        recordSearch(TEST_USER_ID, "Phone");
        recordSearch(TEST_USER_ID, "Phone");

        List<ProductResponse> result = recommendationService.getRecommendations(TEST_USER_ID, 5);

        assertEquals(List.of("e1", "e1"), ids(result));
    }

    @Test
    @DisplayName("검색 이력 - 반복 상품도 limit에 포함됨")
    void testRecommend_SearchHistoryRepeatsCountTowardLimit() {
        recordSearch(TEST_USER_ID, "Java");
        recordSearch(TEST_USER_ID, "Java");
        recordSearch(TEST_USER_ID, "Kotlin");

        List<ProductResponse> result = recommendationService.getRecommendations(TEST_USER_ID, 2);

        assertEquals(List.of("b1", "b1"), ids(result));
    }

    @Test
    @DisplayName("검색 이력 - 카테고리는 매칭에 사용하지 않음, 결과 없으면 인기 상품")
    void testRecommend_SearchOnCategoryFallsToPopularity() {
        recordSearch(TEST_USER_ID, "Books");

        List<ProductResponse> result = recommendationService.getRecommendations(TEST_USER_ID, 1);

        assertEquals(List.of("e1"), ids(result));
    }

    @Test
    @DisplayName("검색 이력 - limit 초과 시 자름")
    void testRecommend_SearchHistoryTierCapped() {
        recordSearch(TEST_USER_ID, "Book");
        recordSearch(TEST_USER_ID, "Pro");

        List<ProductResponse> result = recommendationService.getRecommendations(TEST_USER_ID, 3);

        assertEquals(List.of("b1", "b2", "e1"), ids(result));
    }

    @Test
    @DisplayName("limit 누락/0 이하 - 기본 5개")
    void testRecommend_DefaultLimit() {
        assertEquals(5, recommendationService.getRecommendations(TEST_USER_ID, null).size());
        assertEquals(5, recommendationService.getRecommendations(TEST_USER_ID, 0).size());
    }

    @Test
    @DisplayName("다른 사용자 이력은 영향 없음")
    void testRecommend_IsolatedPerUser() {
        placeOrder("other", "g1");

        List<ProductResponse> result = recommendationService.getRecommendations(TEST_USER_ID, 1);

        assertEquals(List.of("e1"), ids(result));
    }

    @Test
    @DisplayName("추천 실패 - user_id 누락 또는 공백")
    void testRecommend_BlankUserId() {
        InvalidRequestException nullUser = assertThrows(InvalidRequestException.class,
                () -> recommendationService.getRecommendations(null, 5));
        assertEquals(ErrorCode.USER_ID_REQUIRED, nullUser.getErrorCode());

        InvalidRequestException blankUser = assertThrows(InvalidRequestException.class,
                () -> recommendationService.getRecommendations("", 5));
        assertEquals(ErrorCode.USER_ID_REQUIRED, blankUser.getErrorCode());
    }
}
