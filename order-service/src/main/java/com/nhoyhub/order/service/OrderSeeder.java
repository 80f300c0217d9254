package com.nhoyhub.order.service;

import com.nhoyhub.order.config.OrderApiProperties;
import com.nhoyhub.order.model.Order;
import com.nhoyhub.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Fills the empty in-memory store with dummy orders on every start. Order {@code i} is
 * {@code i} hours old, so order 1 is the newest.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderSeeder implements ApplicationRunner {

    private final OrderRepository orderRepository;
    private final OrderApiProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        int count = properties.getOrders().getSeedCount();
        double now = OrderService.nowEpochSeconds();

        for (int i = 1; i <= count; i++) {
            Order.OrderStatus status = i % 3 == 0 ? Order.OrderStatus.APPROVED
                    : i % 5 == 0 ? Order.OrderStatus.REJECTED
                    : Order.OrderStatus.PENDING;

            orderRepository.save(Order.builder()
                    .id(orderRepository.nextId())
                    .name("Dummy Item " + i + " $" + (100 + i))
                    .udid("dummy-" + i + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12))
                    .imageUrl(ImageStorageService.URL_PREFIX + properties.getStorage().getPlaceholderName())
                    .status(status)
                    .downloadLink(i % 3 == 0 ? "http://example.com/download/" + i : null)
                    .createdAt(now - i * 3600.0)
                    .build());
        }

        log.info("Seeded {} dummy orders", count);
    }
}
