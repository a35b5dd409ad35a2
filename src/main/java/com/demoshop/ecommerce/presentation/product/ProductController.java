package com.demoshop.ecommerce.presentation.product;

import com.demoshop.ecommerce.application.product.ProductService;
import com.demoshop.ecommerce.presentation.product.mapper.ProductMapper;
import com.demoshop.ecommerce.presentation.product.response.ProductResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * ProductController - 상품 조회 API (Presentation 계층)
 * GET /products - 상품 목록 조회
 * GET /products/top - 평점 상위 상품 조회
 * GET /products/{id} - 상품 상세 조회
 */
@RestController
@RequestMapping("/products")
public class ProductController {

    private final ProductService productService;
    private final ProductMapper productMapper;

    public ProductController(ProductService productService, ProductMapper productMapper) {
        this.productService = productService;
        this.productMapper = productMapper;
    }

    @GetMapping
    public ResponseEntity<List<ProductResponse>> getProducts() {
        return ResponseEntity.ok(productMapper.toProductResponses(productService.getProducts()));
    }

    /**
     * 평점 상위 상품 조회
     *
     * @param limit 반환 개수 (기본값 5, 0 이하도 5로 처리)
     */
    @GetMapping("/top")
    public ResponseEntity<List<ProductResponse>> getTopProducts(
            @RequestParam(value = "limit", required = false) Integer limit) {
        return ResponseEntity.ok(productMapper.toProductResponses(productService.getTopProducts(limit)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable("id") String productId) {
        return ResponseEntity.ok(productMapper.toProductResponse(productService.getProduct(productId)));
    }
}
