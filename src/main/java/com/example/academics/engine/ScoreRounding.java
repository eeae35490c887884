package com.example.academics.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * The one rounding policy of the engine: one decimal place, half up.
 * Percentages, composite blends, totals and averages all pass through here so a report
 * and a dashboard reading the same marks show the same numbers.
 */
public final class ScoreRounding {

    public static final int SCALE = 1;

    private ScoreRounding() {
    }

    public static double round(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
