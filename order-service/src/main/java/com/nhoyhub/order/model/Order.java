package com.nhoyhub.order.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Order {
    private Long id;

    private String name;
    private String udid;
    private String imageUrl;

    private OrderStatus status;

    private String downloadLink;

    // epoch seconds with fractional part, set once on creation
    private double createdAt;

    public enum OrderStatus {
        PENDING,
        APPROVED,
        REJECTED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * Case-insensitive lookup; empty for anything that is not one of the known statuses.
         */
        public static Optional<OrderStatus> fromValue(String value) {
            if (value == null) {
                return Optional.empty();
            }
            String normalized = value.toUpperCase(Locale.ROOT);
            return Arrays.stream(values())
                    .filter(s -> s.name().equals(normalized))
                    .findFirst();
        }
    }
}
