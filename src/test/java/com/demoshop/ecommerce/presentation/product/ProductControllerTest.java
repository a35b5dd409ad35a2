package com.demoshop.ecommerce.presentation.product;

import com.demoshop.ecommerce.application.product.ProductService;
import com.demoshop.ecommerce.application.product.dto.ProductResponse;
import com.demoshop.ecommerce.common.BaseControllerTest;
import com.demoshop.ecommerce.domain.product.ProductNotFoundException;
import com.demoshop.ecommerce.presentation.common.GlobalExceptionHandler;
import com.demoshop.ecommerce.presentation.product.mapper.ProductMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * ProductControllerTest - Presentation Layer Unit Test
 *
 * 테스트 대상: ProductController
 * - GET /products
 * - GET /products/top?limit=
 * - GET /products/{id}
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ProductController 단위 테스트")
class ProductControllerTest extends BaseControllerTest {

    private MockMvc mockMvc;

    @Mock
    private ProductService productService;

    @BeforeEach
    void setup() {
        ProductController controller = new ProductController(productService, new ProductMapper());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private ProductResponse iphone() {
        return ProductResponse.builder()
                .productId("1")
                .productName("iPhone 15 Pro")
                .description("Latest iPhone with advanced features")
                .price(new BigDecimal("999.99"))
                .category("Electronics")
                .stock(50)
                .rating(4.5)
                .imageUrl("https://example.com/iphone15pro.jpg")
                .build();
    }

    @Test
    @DisplayName("상품 목록 조회 - snake_case 필드")
    void testGetProducts() throws Exception {
        when(productService.getProducts()).thenReturn(List.of(iphone()));

        mockMvc.perform(get("/products"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("1"))
                .andExpect(jsonPath("$[0].name").value("iPhone 15 Pro"))
                .andExpect(jsonPath("$[0].price").value(999.99))
                .andExpect(jsonPath("$[0].stock").value(50))
                .andExpect(jsonPath("$[0].rating").value(4.5))
                .andExpect(jsonPath("$[0].image_url").value("https://example.com/iphone15pro.jpg"));
    }

    @Test
    @DisplayName("상품 상세 조회 - 성공")
    void testGetProduct() throws Exception {
        when(productService.getProduct("1")).thenReturn(iphone());

        mockMvc.perform(get("/products/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.category").value("Electronics"));
    }

    @Test
    @DisplayName("상품 상세 조회 - 없는 상품 404")
    void testGetProduct_NotFound() throws Exception {
        when(productService.getProduct("999")).thenThrow(new ProductNotFoundException("999"));

        mockMvc.perform(get("/products/999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_PRODUCT_NOT_FOUND"))
                .andExpect(jsonPath("$.error_type").value("NOT_FOUND"))
                .andExpect(jsonPath("$.request_id").exists());
    }

    @Test
    @DisplayName("평점 상위 상품 - limit 전달")
    void testGetTopProducts() throws Exception {
        when(productService.getTopProducts(3)).thenReturn(List.of(iphone()));

        mockMvc.perform(get("/products/top").param("limit", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    @DisplayName("평점 상위 상품 - limit 형식 오류 400")
    void testGetTopProducts_InvalidLimit() throws Exception {
        mockMvc.perform(get("/products/top").param("limit", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_INVALID_REQUEST"));

        verify(productService, never()).getTopProducts(any());
    }
}
