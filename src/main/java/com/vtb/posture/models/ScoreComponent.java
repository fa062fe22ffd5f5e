package com.vtb.posture.models;

/**
 * Девять измерений оценки защищенности в фиксированном порядке объявления.
 * Порядок используется в отчетах и при сортировке рекомендаций одной критичности.
 */
public enum ScoreComponent {
    IP_WHITELIST("ip_whitelist_coverage", "IP Whitelist Coverage", 0.15, 60.0),
    THROTTLING("throttling_configured", "Throttling Configuration", 0.15, 60.0),
    QUOTA("quota_configured", "Quota Configuration", 0.05, 50.0),
    AUTHENTICATION("authentication_strength", "Authentication Strength", 0.20, 50.0),
    ALLOWED_HOURS("allowed_hours", "Allowed Hours", 0.05, 50.0),
    TRAFFIC_ANOMALY("traffic_anomaly", "Traffic Anomaly", 0.05, 70.0),
    ERROR_RATE("error_rate", "Error Rate", 0.05, 75.0),
    SSL_TLS("ssl_tls_status", "SSL/TLS Status", 0.10, 80.0),
    LOGGING("logging_status", "Logging Status", 0.20, 80.0);
    
    private final String id;
    private final String displayName;
    private final double defaultWeight;
    private final double defaultThreshold;
    
    ScoreComponent(String id, String displayName, double defaultWeight, double defaultThreshold) {
        this.id = id;
        this.displayName = displayName;
        this.defaultWeight = defaultWeight;
        this.defaultThreshold = defaultThreshold;
    }
    
    public String getId() {
        return id;
    }
    
    public String getDisplayName() {
        return displayName;
    }
    
    public double getDefaultWeight() {
        return defaultWeight;
    }
    
    /**
     * Порог "приемлемости": оценка ниже порога порождает рекомендацию
     */
    public double getDefaultThreshold() {
        return defaultThreshold;
    }
    
    /**
     * Найти компонент по идентификатору (ip_whitelist_coverage) или имени (IP_WHITELIST)
     */
    public static ScoreComponent fromId(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (ScoreComponent component : values()) {
            if (component.id.equalsIgnoreCase(trimmed) || component.name().equalsIgnoreCase(trimmed)) {
                return component;
            }
        }
        return null;
    }
}
