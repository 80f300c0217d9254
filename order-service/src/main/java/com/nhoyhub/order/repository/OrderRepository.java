package com.nhoyhub.order.repository;

import com.nhoyhub.order.model.Order;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * In-memory order collection, lost on restart.
 * <p>
 * All access goes through one read/write lock. Callers only ever see copies of the stored
 * records, so a create, update or delete becomes visible as a whole or not at all.
 * Ids come from a counter that is never rewound, so an id is not handed out twice even
 * after deletions.
 */
@Repository
public class OrderRepository {

    private static final Comparator<Order> NEWEST_FIRST =
            Comparator.comparingDouble(Order::getCreatedAt).reversed();

    private final List<Order> orders = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public long nextId() {
        return sequence.incrementAndGet();
    }

    public Order save(Order order) {
        lock.writeLock().lock();
        try {
            orders.add(order.toBuilder().build());
            return order.toBuilder().build();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Order> findById(long id) {
        lock.readLock().lock();
        try {
            return orders.stream()
                    .filter(o -> o.getId() == id)
                    .findFirst()
                    .map(o -> o.toBuilder().build());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Applies {@code changes} to a copy of the stored order and swaps the copy in.
     *
     * @return the updated order, or empty if no order has this id
     */
    public Optional<Order> update(long id, Consumer<Order> changes) {
        lock.writeLock().lock();
        try {
            for (int i = 0; i < orders.size(); i++) {
                if (orders.get(i).getId() == id) {
                    Order updated = orders.get(i).toBuilder().build();
                    changes.accept(updated);
                    orders.set(i, updated);
                    return Optional.of(updated.toBuilder().build());
                }
            }
            return Optional.empty();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean deleteById(long id) {
        lock.writeLock().lock();
        try {
            return orders.removeIf(o -> o.getId() == id);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Filters by status (when given) and by a case-insensitive substring of name or udid
     * (when given), newest first. Orders created at the same instant keep insertion order.
     */
    public List<Order> findMatching(Order.OrderStatus status, String search) {
        String needle = search == null || search.isEmpty() ? null : search.toLowerCase(Locale.ROOT);

        lock.readLock().lock();
        try {
            return orders.stream()
                    .filter(o -> status == null || o.getStatus() == status)
                    .filter(o -> needle == null
                            || o.getName().toLowerCase(Locale.ROOT).contains(needle)
                            || o.getUdid().toLowerCase(Locale.ROOT).contains(needle))
                    .sorted(NEWEST_FIRST)
                    .map(o -> o.toBuilder().build())
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long count() {
        lock.readLock().lock();
        try {
            return orders.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
