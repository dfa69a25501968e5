package com.ucp.merchant.presentation.order;

import com.ucp.merchant.application.order.OrderLedger;
import com.ucp.merchant.presentation.order.response.OrderResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * OrderController - 주문 조회 API
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderLedger orderLedger;

    public OrderController(OrderLedger orderLedger) {
        this.orderLedger = orderLedger;
    }

    /**
     * GET /orders/{order_id}
     */
    @GetMapping("/{order_id}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable("order_id") String orderId) {
        return ResponseEntity.ok(OrderResponse.from(orderLedger.findOrder(orderId)));
    }
}
