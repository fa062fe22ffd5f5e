package com.vtb.posture.models;

/**
 * Качественный уровень защищенности.
 * Единственное место, где число превращается в ярлык и цвет:
 * используется и для итоговой оценки, и для оценок отдельных компонентов.
 */
public enum SecurityLevel {
    EXCELLENT("Excellent", 90.0, "#27ae60"),
    GOOD("Good", 75.0, "#2ecc71"),
    FAIR("Fair", 60.0, "#f39c12"),
    POOR("Poor", 40.0, "#e67e22"),
    CRITICAL("Critical", 0.0, "#e74c3c");
    
    private final String label;
    private final double lowerBound;
    private final String color;
    
    SecurityLevel(String label, double lowerBound, String color) {
        this.label = label;
        this.lowerBound = lowerBound;
        this.color = color;
    }
    
    /**
     * Нижняя граница включительно, проверка сверху вниз
     */
    public static SecurityLevel fromScore(double score) {
        for (SecurityLevel level : values()) {
            if (score >= level.lowerBound) {
                return level;
            }
        }
        return CRITICAL;
    }
    
    public String getLabel() {
        return label;
    }
    
    public double getLowerBound() {
        return lowerBound;
    }
    
    public String getColor() {
        return color;
    }
}
