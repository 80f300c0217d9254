package com.nhoyhub.order.converter;

import com.nhoyhub.order.model.Order;
import com.nhoyhub.order.resource.OrderResource;
import com.nhoyhub.order.service.PriceExtractor;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

@Component
public class OrderToOrderResourceConverter implements Converter<Order, OrderResource> {

    @Override
    public OrderResource convert(Order order) {
        return OrderResource.builder()
                .id(order.getId())
                .name(order.getName())
                .udid(order.getUdid())
                .imageUrl(order.getImageUrl())
                .status(order.getStatus())
                .downloadLink(order.getDownloadLink())
                .createdAt(order.getCreatedAt())
                .price(PriceExtractor.extractPrice(order.getName()))
                .build();
    }
}
