package com.vtb.posture.models;

/**
 * Уровни критичности рекомендаций
 */
public enum Severity {
    CRITICAL("critical", "Критический", 4, "#e74c3c"),
    HIGH("high", "Высокий", 3, "#e67e22"),
    MEDIUM("medium", "Средний", 2, "#f39c12"),
    LOW("low", "Низкий", 1, "#3498db");
    
    private final String code;
    private final String russianName;
    private final int priority;
    private final String color;
    
    Severity(String code, String russianName, int priority, String color) {
        this.code = code;
        this.russianName = russianName;
        this.priority = priority;
        this.color = color;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getRussianName() {
        return russianName;
    }
    
    public int getPriority() {
        return priority;
    }
    
    public String getColor() {
        return color;
    }
}
