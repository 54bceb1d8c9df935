package com.dexrouter.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class PriceUtils {

    public static final int PRICE_SCALE = 8;
    public static final int FEE_SCALE = 4;
    public static final int LIQUIDITY_SCALE = 2;

    private PriceUtils() {
    }

    public static BigDecimal price(double value) {
        return scale(value, PRICE_SCALE);
    }

    public static BigDecimal fee(double value) {
        return scale(value, FEE_SCALE);
    }

    public static BigDecimal liquidity(double value) {
        return scale(value, LIQUIDITY_SCALE);
    }

    public static BigDecimal scale(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP);
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
