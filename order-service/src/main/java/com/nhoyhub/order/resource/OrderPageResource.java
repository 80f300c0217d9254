package com.nhoyhub.order.resource;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderPageResource {
    private List<OrderResource> items;
    // matching orders before paging
    private long total;
    private int page;
    private int pageSize;
}
