package com.demoshop.ecommerce.integration;

import com.demoshop.ecommerce.application.cart.CartService;
import com.demoshop.ecommerce.application.cart.dto.CartItemCommand;
import com.demoshop.ecommerce.application.cart.dto.CartResponseDto;
import com.demoshop.ecommerce.application.order.OrderService;
import com.demoshop.ecommerce.application.order.dto.OrderResponse;
import com.demoshop.ecommerce.domain.order.EmptyCartException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * CartConcurrencyIntegrationTest - 사용자별 락(@UserLock) 동시성 테스트
 *
 * 시나리오:
 * 1. 같은 사용자가 같은 상품을 동시에 추가 → 수량이 유실 없이 누적
 * 2. 추가와 결제가 동시에 실행 → 모든 추가 수량이 주문 또는 남은 장바구니 중 정확히 한 곳에 존재
 *
 * CountDownLatch로 동시 시작을 맞춘다.
 */
@SpringBootTest
@DisplayName("장바구니 동시성 제어 테스트")
class CartConcurrencyIntegrationTest {

    @Autowired
    private CartService cartService;

    @Autowired
    private OrderService orderService;

    private CartItemCommand command(String productId, int quantity) {
        return CartItemCommand.builder().productId(productId).quantity(quantity).build();
    }

    @Test
    @DisplayName("같은 상품 동시 추가 - 수량 누적, 총액 일관성")
    void testConcurrentAdd_QuantityAccumulates() throws InterruptedException {
        // Given
        String userId = "concurrent-" + UUID.randomUUID().toString().substring(0, 8);
        int numThreads = 30;
        ExecutorService executor = Executors.newFixedThreadPool(10);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch endLatch = new CountDownLatch(numThreads);
        AtomicInteger successCount = new AtomicInteger(0);

        // When
        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    cartService.addItem(userId, command("3", 1));
                    successCount.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    endLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(endLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        // Then
        CartResponseDto cart = cartService.getCart(userId);
        assertEquals(numThreads, successCount.get());
        assertEquals(1, cart.getItems().size());
        assertEquals(numThreads, cart.getItems().get(0).getQuantity());
        assertThat(cart.getTotalPrice())
                .isEqualByComparingTo(new BigDecimal("249.99").multiply(BigDecimal.valueOf(numThreads)));
    }

    @Test
    @DisplayName("추가와 결제 동시 실행 - 수량 유실/중복 없음")
    void testConcurrentAddAndCheckout_NoLostItems() throws InterruptedException {
        // Given
        String userId = "checkout-" + UUID.randomUUID().toString().substring(0, 8);
        cartService.addItem(userId, command("4", 1));
        int adders = 20;
        int checkouts = 5;
        ExecutorService executor = Executors.newFixedThreadPool(10);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch endLatch = new CountDownLatch(adders + checkouts);
        AtomicInteger emptyCartFailures = new AtomicInteger(0);

        // When
        for (int i = 0; i < adders; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    cartService.addItem(userId, command("4", 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    endLatch.countDown();
                }
            });
        }
        for (int i = 0; i < checkouts; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    orderService.checkout(userId);
                } catch (EmptyCartException e) {
                    emptyCartFailures.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    endLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(endLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        // Then
        List<OrderResponse> orders = orderService.getOrderHistory(userId);
        int orderedQuantity = orders.stream()
                .flatMap(order -> order.getItems().stream())
                .mapToInt(item -> item.getQuantity())
                .sum();
        int remainingQuantity = cartService.getCart(userId).getItems().stream()
                .mapToInt(item -> item.getQuantity())
                .sum();

        assertEquals(adders + 1, orderedQuantity + remainingQuantity);
        assertEquals(checkouts, orders.size() + emptyCartFailures.get());
        for (OrderResponse order : orders) {
            int quantity = order.getItems().get(0).getQuantity();
            assertThat(order.getTotalPrice())
                    .isEqualByComparingTo(new BigDecimal("599.99").multiply(BigDecimal.valueOf(quantity)));
        }
    }
}
