package com.nhoyhub.order.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of both config writes: {@code /config/public} reads {@code public_image_url},
 * {@code /config/esign/{index}} reads {@code url}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigUpdateRequest {
    private String publicImageUrl;
    private String url;
}
