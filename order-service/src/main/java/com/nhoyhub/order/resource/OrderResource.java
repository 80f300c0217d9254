package com.nhoyhub.order.resource;

import com.nhoyhub.order.model.Order;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResource {
    private Long id;
    private String name;
    private String udid;
    private String imageUrl;
    private Order.OrderStatus status;
    private String downloadLink;
    private double createdAt;
    private String price;
}
