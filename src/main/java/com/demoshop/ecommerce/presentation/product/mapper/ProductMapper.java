package com.demoshop.ecommerce.presentation.product.mapper;

import com.demoshop.ecommerce.application.product.dto.ProductResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ProductMapper - Application ProductResponse → Presentation ProductResponse 변환
 * 상품 목록을 반환하는 모든 API(상품, 검색, 추천)가 공유한다.
 */
@Component
public class ProductMapper {

    public com.demoshop.ecommerce.presentation.product.response.ProductResponse toProductResponse(ProductResponse product) {
        return com.demoshop.ecommerce.presentation.product.response.ProductResponse.builder()
                .productId(product.getProductId())
                .productName(product.getProductName())
                .description(product.getDescription())
                .price(product.getPrice())
                .category(product.getCategory())
                .stock(product.getStock())
                .rating(product.getRating())
                .imageUrl(product.getImageUrl())
                .build();
    }

    public List<com.demoshop.ecommerce.presentation.product.response.ProductResponse> toProductResponses(List<ProductResponse> products) {
        return products.stream()
                .map(this::toProductResponse)
                .collect(Collectors.toList());
    }
}
