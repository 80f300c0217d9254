package com.nhoyhub.order.repository;

import com.nhoyhub.order.config.OrderApiProperties;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed set of six configuration slots. Keys are declared once at start-up; only values change.
 */
@Repository
public class ConfigRepository {

    public static final String PUBLIC_IMAGE_URL = "public_image_url";
    public static final int ESIGN_SLOTS = 5;

    private final Map<String, String> values = new LinkedHashMap<>();

    public ConfigRepository(OrderApiProperties properties) {
        values.put(PUBLIC_IMAGE_URL, properties.getConfig().getPublicImageUrl());
        for (int i = 1; i <= ESIGN_SLOTS; i++) {
            values.put(esignKey(i), "");
        }
    }

    public static String esignKey(int index) {
        return "esign_image_" + index;
    }

    public synchronized Map<String, String> findAll() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public synchronized void put(String key, String value) {
        if (!values.containsKey(key)) {
            throw new IllegalArgumentException("Unknown config key: " + key);
        }
        values.put(key, value);
    }
}
