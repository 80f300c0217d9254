package com.nhoyhub.order.controller;

import com.nhoyhub.order.dto.OrderRequest;
import com.nhoyhub.order.dto.OrderUpdateRequest;
import com.nhoyhub.order.resource.OrderPageResource;
import com.nhoyhub.order.resource.OrderResource;
import com.nhoyhub.order.security.AdminOnly;
import com.nhoyhub.order.service.OrderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@Slf4j
@RestController
@RequestMapping("/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<OrderResource> createOrder(@RequestParam String name,
                                                     @RequestParam String udid,
                                                     @RequestParam("image") MultipartFile image) {
        log.info("Received create order request - name: {}, udid: {}", name, udid);
        OrderRequest request = OrderRequest.builder()
                .name(name)
                .udid(udid)
                .build();
        OrderResource response = orderService.createOrder(request, image);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<OrderPageResource> listOrders(@RequestParam(defaultValue = "1") int page,
                                                        @RequestParam(name = "page_size", required = false) Integer pageSize,
                                                        @RequestParam(required = false) String status,
                                                        @RequestParam(required = false) String q) {
        log.info("Received list orders request - page: {}, page_size: {}, status: {}, q: {}", page, pageSize, status, q);
        return ResponseEntity.ok(orderService.listOrders(status, q, page, pageSize));
    }

    @AdminOnly
    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResource> getOrder(@PathVariable long orderId) {
        log.info("Received get order request: {}", orderId);
        return ResponseEntity.ok(orderService.getOrder(orderId));
    }

    @AdminOnly
    @PutMapping(path = "/{orderId}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<OrderResource> updateOrder(@PathVariable long orderId,
                                                     @RequestParam String name,
                                                     @RequestParam String udid,
                                                     @RequestParam String status,
                                                     @RequestParam(name = "download_link", required = false) String downloadLink,
                                                     @RequestParam(name = "image", required = false) MultipartFile image) {
        log.info("Received update order request: {}, status: {}", orderId, status);
        OrderUpdateRequest request = OrderUpdateRequest.builder()
                .name(name)
                .udid(udid)
                .status(status)
                .downloadLink(downloadLink)
                .build();
        return ResponseEntity.ok(orderService.updateOrder(orderId, request, image));
    }

    @AdminOnly
    @DeleteMapping("/{orderId}")
    public ResponseEntity<Void> deleteOrder(@PathVariable long orderId) {
        log.info("Received delete order request: {}", orderId);
        orderService.deleteOrder(orderId);
        return ResponseEntity.noContent().build();
    }
}
