package com.demoshop.ecommerce.application.recommendation.strategy;

import com.demoshop.ecommerce.application.recommendation.RecommendationContext;
import com.demoshop.ecommerce.application.recommendation.RecommendationStrategy;
import com.demoshop.ecommerce.domain.order.Order;
import com.demoshop.ecommerce.domain.order.OrderItem;
import com.demoshop.ecommerce.domain.order.OrderRepository;
import com.demoshop.ecommerce.domain.product.Product;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 주문 이력 기반 추천
 *
 * 1. 사용자 주문의 모든 항목을 카탈로그로 조회해 카테고리별 빈도를 센다
 *    (카탈로그에서 사라진 상품은 무시)
 * 2. 카탈로그 순서대로 빈도가 양수인 카테고리의 상품을 limit개까지 모은다
 *
 * 빈도는 포함 여부 판단에만 쓰고 순위에는 반영하지 않는다.
 */
@Component
public class OrderHistoryRecommendationStrategy implements RecommendationStrategy {

    private final OrderRepository orderRepository;

    public OrderHistoryRecommendationStrategy(OrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    @Override
    public String getName() {
        return "ORDER_HISTORY";
    }

    @Override
    public List<Product> recommend(RecommendationContext context) {
        List<Order> orders = orderRepository.findByUserId(context.getUserId());
        if (orders.isEmpty()) {
            return List.of();
        }

        Map<String, Integer> categoryCount = new HashMap<>();
        for (Order order : orders) {
            for (OrderItem item : order.getOrderItems()) {
                context.findProduct(item.getProductId())
                        .ifPresent(product -> categoryCount.merge(product.getCategory(), 1, Integer::sum));
            }
        }
        if (categoryCount.isEmpty()) {
            return List.of();
        }

        List<Product> recommendations = new ArrayList<>();
        for (Product product : context.getCatalog()) {
            if (recommendations.size() >= context.getLimit()) {
                break;
            }
            if (categoryCount.getOrDefault(product.getCategory(), 0) > 0) {
                recommendations.add(product);
            }
        }
        return recommendations;
    }

    @Override
    public int getOrder() {
        return 1;
    }
}
