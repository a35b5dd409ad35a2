package com.demoshop.ecommerce.presentation.search;

import com.demoshop.ecommerce.application.product.dto.ProductResponse;
import com.demoshop.ecommerce.application.search.SearchService;
import com.demoshop.ecommerce.common.BaseControllerTest;
import com.demoshop.ecommerce.common.exception.ErrorCode;
import com.demoshop.ecommerce.common.exception.InvalidRequestException;
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

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("SearchController 단위 테스트")
class SearchControllerTest extends BaseControllerTest {

    private MockMvc mockMvc;

    @Mock
    private SearchService searchService;

    @BeforeEach
    void setup() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SearchController(searchService, new ProductMapper()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("검색 - q와 user_id 전달")
    void testSearch() throws Exception {
        ProductResponse airpods = ProductResponse.builder()
                .productId("3").productName("AirPods Pro").price(new BigDecimal("249.99"))
                .category("Electronics").stock(100).rating(4.6).build();
        when(searchService.search("Pods", "user-1")).thenReturn(List.of(airpods));

        mockMvc.perform(get("/search").param("q", "Pods").param("user_id", "user-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("3"))
                .andExpect(jsonPath("$[0].name").value("AirPods Pro"));
    }

    @Test
    @DisplayName("검색 실패 - q 누락 400")
    void testSearch_MissingQuery() throws Exception {
        when(searchService.search(null, null))
                .thenThrow(new InvalidRequestException(ErrorCode.SEARCH_QUERY_REQUIRED));

        mockMvc.perform(get("/search"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_SEARCH_QUERY_REQUIRED"));
    }
}
