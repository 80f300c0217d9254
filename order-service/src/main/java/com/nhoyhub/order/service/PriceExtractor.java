package com.nhoyhub.order.service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the display price out of an order name, e.g. {@code "Case $999"} gives {@code "999"}.
 */
public final class PriceExtractor {

    public static final String NO_PRICE = "N/A";

    private static final Pattern PRICE = Pattern.compile("\\$(\\d+)", Pattern.UNICODE_CHARACTER_CLASS);

    private PriceExtractor() {
    }

    public static String extractPrice(String name) {
        if (name == null) {
            return NO_PRICE;
        }
        Matcher matcher = PRICE.matcher(name);
        return matcher.find() ? matcher.group(1) : NO_PRICE;
    }
}
