package com.demoshop.ecommerce.presentation.search;

import com.demoshop.ecommerce.application.search.SearchService;
import com.demoshop.ecommerce.presentation.product.mapper.ProductMapper;
import com.demoshop.ecommerce.presentation.product.response.ProductResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * SearchController - 상품 검색 API
 * GET /search?q={query}&user_id={userId} - 검색 (user_id가 있으면 검색 이력 기록)
 */
@RestController
@RequestMapping("/search")
public class SearchController {

    private final SearchService searchService;
    private final ProductMapper productMapper;

    public SearchController(SearchService searchService, ProductMapper productMapper) {
        this.searchService = searchService;
        this.productMapper = productMapper;
    }

    @GetMapping
    public ResponseEntity<List<ProductResponse>> search(
            @RequestParam(value = "q", required = false) String query,
            @RequestParam(value = "user_id", required = false) String userId) {
        return ResponseEntity.ok(productMapper.toProductResponses(searchService.search(query, userId)));
    }
}
