package com.demoshop.ecommerce.presentation.order;

import com.demoshop.ecommerce.application.order.OrderService;
import com.demoshop.ecommerce.presentation.order.mapper.OrderMapper;
import com.demoshop.ecommerce.presentation.order.response.OrderResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * OrderController - Presentation 계층
 * POST /checkout?user_id={userId} - 장바구니 결제 (주문 생성)
 * GET /orders/{userId} - 주문 이력 조회
 */
@RestController
public class OrderController {

    private final OrderService orderService;
    private final OrderMapper orderMapper;

    public OrderController(OrderService orderService, OrderMapper orderMapper) {
        this.orderService = orderService;
        this.orderMapper = orderMapper;
    }

    @PostMapping("/checkout")
    public ResponseEntity<OrderResponse> checkout(
            @RequestParam(value = "user_id", required = false) String userId) {
        return ResponseEntity.ok(orderMapper.toOrderResponse(orderService.checkout(userId)));
    }

    @GetMapping("/orders/{userId}")
    public ResponseEntity<List<OrderResponse>> getOrderHistory(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(orderMapper.toOrderResponses(orderService.getOrderHistory(userId)));
    }
}
