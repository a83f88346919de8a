package com.rockpoint.payments.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Converts between display amounts (UZS) and minor units (tiyin, 1/100 UZS).
 * All arithmetic is done on {@link BigDecimal}; no floating point.
 */
public final class MoneyUnits {

    private static final int MINOR_DIGITS = 2;

    private MoneyUnits() {}

    /** round(major * 100), half-up. */
    public static long toMinorUnits(BigDecimal major) {
        if (major == null) {
            throw new IllegalArgumentException("amount is required");
        }
        return major.movePointRight(MINOR_DIGITS)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    public static BigDecimal toMajorUnits(long minor) {
        return BigDecimal.valueOf(minor, MINOR_DIGITS);
    }
}
