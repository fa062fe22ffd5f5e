package com.vtb.posture.core;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Арифметика оценок: округление и ограничение диапазона
 */
final class Scores {
    
    static final double MIN = 0.0;
    static final double MAX = 100.0;
    
    private Scores() {
    }
    
    static double round2(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
    
    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return MIN;
        }
        return Math.max(MIN, Math.min(MAX, value));
    }
    
    static double percentage(long part, long total) {
        if (total <= 0) {
            return 0.0;
        }
        return round2(part * 100.0 / total);
    }
    
    static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
