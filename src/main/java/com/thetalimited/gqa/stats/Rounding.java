package com.thetalimited.gqa.stats;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Rounding
{
    private Rounding()
    {
    }

    /**
     * Rounds half to even at {@code precision} decimals; NaN and infinities
     * pass through.
     */
    public static double round(double value, int precision)
    {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(precision, RoundingMode.HALF_EVEN).doubleValue();
    }
}
