package com.demoshop.ecommerce.presentation.cart;

import com.demoshop.ecommerce.application.cart.CartService;
import com.demoshop.ecommerce.presentation.cart.mapper.CartMapper;
import com.demoshop.ecommerce.presentation.cart.request.CartItemRequest;
import com.demoshop.ecommerce.presentation.cart.response.CartResponseDto;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * CartController - Presentation 계층
 * 장바구니 API 요청 처리
 */
@RestController
@RequestMapping("/cart")
public class CartController {

    private final CartService cartService;
    private final CartMapper cartMapper;

    public CartController(CartService cartService, CartMapper cartMapper) {
        this.cartService = cartService;
        this.cartMapper = cartMapper;
    }

    /**
     * POST /cart/add?user_id={userId} - 장바구니 아이템 추가
     */
    @PostMapping("/add")
    public ResponseEntity<CartResponseDto> addItem(
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestBody CartItemRequest request) {
        return ResponseEntity.ok(cartMapper.toCartResponseDto(
                cartService.addItem(userId, cartMapper.toCartItemCommand(request))));
    }

    /**
     * DELETE /cart/remove?user_id={userId} - 장바구니 아이템 제거 (요청 본문에 상품/수량)
     */
    @DeleteMapping("/remove")
    public ResponseEntity<CartResponseDto> removeItem(
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestBody CartItemRequest request) {
        return ResponseEntity.ok(cartMapper.toCartResponseDto(
                cartService.removeItem(userId, cartMapper.toCartItemCommand(request))));
    }

    /**
     * GET /cart/{userId} - 장바구니 조회
     */
    @GetMapping("/{userId}")
    public ResponseEntity<CartResponseDto> getCart(
            @PathVariable("userId") String userId) {
        return ResponseEntity.ok(cartMapper.toCartResponseDto(cartService.getCart(userId)));
    }
}
