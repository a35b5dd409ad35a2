package com.demoshop.ecommerce.presentation.product.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 상품 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductResponse {

    @JsonProperty("id")
    private String productId;

    @JsonProperty("name")
    private String productName;

    private String description;

    private BigDecimal price;

    private String category;

    private Integer stock;

    private Double rating;

    @JsonProperty("image_url")
    private String imageUrl;
}
