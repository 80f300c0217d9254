package com.nhoyhub.order.service;

import com.nhoyhub.order.config.OrderApiProperties;
import com.nhoyhub.order.dto.OrderRequest;
import com.nhoyhub.order.dto.OrderUpdateRequest;
import com.nhoyhub.order.exception.OrderNotFoundException;
import com.nhoyhub.order.exception.ValidationException;
import com.nhoyhub.order.metrics.OrderMetrics;
import com.nhoyhub.order.model.Order;
import com.nhoyhub.order.repository.OrderRepository;
import com.nhoyhub.order.resource.OrderPageResource;
import com.nhoyhub.order.resource.OrderResource;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.convert.ConversionService;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

    private final OrderRepository orderRepository;
    private final ImageStorageService imageStorageService;
    private final ConversionService conversionService;
    private final Validator validator;
    private final OrderMetrics orderMetrics;
    private final OrderApiProperties properties;

    public OrderResource createOrder(OrderRequest request, MultipartFile image) {
        validate(request);
        log.info("Creating order - name: {}, udid: {}", request.getName(), request.getUdid());

        long orderId = orderRepository.nextId();
        // a failed write aborts before anything is recorded
        String imageUrl = imageStorageService.save(image, orderId);

        Order order = Order.builder()
                .id(orderId)
                .name(request.getName())
                .udid(request.getUdid())
                .imageUrl(imageUrl)
                .status(Order.OrderStatus.PENDING)
                .downloadLink(null)
                .createdAt(nowEpochSeconds())
                .build();
        Order saved = orderRepository.save(order);
        orderMetrics.incrementOrdersCreated();

        log.info("Order created: {}", orderId);
        return conversionService.convert(saved, OrderResource.class);
    }

    public OrderResource getOrder(long orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> notFound(orderId));
        return conversionService.convert(order, OrderResource.class);
    }

    /**
     * Filters by status (unknown values are ignored) and by search text, newest first, then
     * cuts out one page. {@code page} below 1 is treated as 1; {@code pageSize} is clamped
     * to {@code [1, max-page-size]}, and a missing {@code pageSize} means default-page-size.
     */
    public OrderPageResource listOrders(String status, String query, int page, Integer pageSize) {
        int requestedPageSize = pageSize != null ? pageSize : properties.getOrders().getDefaultPageSize();
        int effectivePage = Math.max(page, 1);
        int effectivePageSize = Math.min(Math.max(requestedPageSize, 1), properties.getOrders().getMaxPageSize());

        Order.OrderStatus statusFilter = null;
        if (StringUtils.hasText(status)) {
            statusFilter = Order.OrderStatus.fromValue(status).orElse(null);
            if (statusFilter == null) {
                log.debug("Ignoring unknown status filter: {}", status);
            }
        }

        List<Order> matching = orderRepository.findMatching(statusFilter, query);

        long start = (long) (effectivePage - 1) * effectivePageSize;
        List<OrderResource> items = matching.stream()
                .skip(start)
                .limit(effectivePageSize)
                .map(o -> conversionService.convert(o, OrderResource.class))
                .toList();

        return OrderPageResource.builder()
                .items(items)
                .total(matching.size())
                .page(effectivePage)
                .pageSize(effectivePageSize)
                .build();
    }

    /**
     * Overwrites name, udid, status and download link. The image is replaced only when a file
     * with a name is supplied.
     */
    public OrderResource updateOrder(long orderId, OrderUpdateRequest request, MultipartFile image) {
        validate(request);
        Order.OrderStatus status = Order.OrderStatus.fromValue(request.getStatus())
                .orElseThrow(() -> new ValidationException(
                        "Invalid status: " + request.getStatus() + ". Expected one of pending, approved, rejected"));

        if (orderRepository.findById(orderId).isEmpty()) {
            throw notFound(orderId);
        }

        String imageUrl = null;
        if (image != null && StringUtils.hasText(image.getOriginalFilename())) {
            imageUrl = imageStorageService.save(image, orderId);
        }

        String newImageUrl = imageUrl;
        String downloadLink = StringUtils.hasText(request.getDownloadLink()) ? request.getDownloadLink() : null;
        Order updated = orderRepository.update(orderId, order -> {
                    if (newImageUrl != null) {
                        order.setImageUrl(newImageUrl);
                    }
                    order.setName(request.getName());
                    order.setUdid(request.getUdid());
                    order.setStatus(status);
                    order.setDownloadLink(downloadLink);
                })
                .orElseThrow(() -> notFound(orderId));
        orderMetrics.incrementOrdersUpdated();

        log.info("Order updated: {}, status: {}", orderId, status.value());
        return conversionService.convert(updated, OrderResource.class);
    }

    public void deleteOrder(long orderId) {
        if (!orderRepository.deleteById(orderId)) {
            throw notFound(orderId);
        }
        orderMetrics.incrementOrdersDeleted();
        log.info("Order deleted: {}", orderId);
    }

    private <T> void validate(T request) {
        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ValidationException(message);
        }
    }

    private OrderNotFoundException notFound(long orderId) {
        log.warn("Order not found: {}", orderId);
        return new OrderNotFoundException(orderId);
    }

    static double nowEpochSeconds() {
        return System.currentTimeMillis() / 1000.0;
    }
}
