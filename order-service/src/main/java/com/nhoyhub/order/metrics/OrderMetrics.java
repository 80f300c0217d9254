package com.nhoyhub.order.metrics;

import com.nhoyhub.order.repository.OrderRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;
import org.springframework.stereotype.Component;

/**
 * Application counters exported through the Prometheus registry.
 *
 * View at: http://localhost:8000/actuator/prometheus
 *
 * Key metrics:
 * - orders.created              → orders accepted through POST /orders
 * - orders.updated              → admin edits
 * - orders.deleted              → admin deletions
 * - orders.stored               → current size of the in-memory collection
 * - auth.login.failures         → rejected username/password pairs
 * - auth.token.rejections       → admin calls with a missing or wrong token
 * - images.placeholder.served   → image requests answered with the placeholder
 */
@Component
@Getter
public class OrderMetrics {

    private final Counter ordersCreatedCounter;
    private final Counter ordersUpdatedCounter;
    private final Counter ordersDeletedCounter;
    private final Counter loginFailuresCounter;
    private final Counter tokenRejectionsCounter;
    private final Counter placeholderServedCounter;

    public OrderMetrics(MeterRegistry registry, OrderRepository orderRepository) {
        this.ordersCreatedCounter = Counter.builder("orders.created")
                .description("Orders submitted by clients")
                .register(registry);

        this.ordersUpdatedCounter = Counter.builder("orders.updated")
                .description("Orders edited by the administrator")
                .register(registry);

        this.ordersDeletedCounter = Counter.builder("orders.deleted")
                .description("Orders removed by the administrator")
                .register(registry);

        this.loginFailuresCounter = Counter.builder("auth.login.failures")
                .description("Rejected login attempts")
                .register(registry);

        this.tokenRejectionsCounter = Counter.builder("auth.token.rejections")
                .description("Admin requests with a missing or invalid bearer token")
                .register(registry);

        this.placeholderServedCounter = Counter.builder("images.placeholder.served")
                .description("Image requests answered with the placeholder file")
                .register(registry);

        Gauge.builder("orders.stored", orderRepository, OrderRepository::count)
                .description("Orders currently held in memory")
                .register(registry);
    }

    public void incrementOrdersCreated() {
        ordersCreatedCounter.increment();
    }

    public void incrementOrdersUpdated() {
        ordersUpdatedCounter.increment();
    }

    public void incrementOrdersDeleted() {
        ordersDeletedCounter.increment();
    }

    public void incrementLoginFailures() {
        loginFailuresCounter.increment();
    }

    public void incrementTokenRejections() {
        tokenRejectionsCounter.increment();
    }

    public void incrementPlaceholderServed() {
        placeholderServedCounter.increment();
    }
}
