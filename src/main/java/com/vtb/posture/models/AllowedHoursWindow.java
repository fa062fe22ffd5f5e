package com.vtb.posture.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Окно разрешенного времени доступа: [startHour, endHour) в часовом поясе эндпоинта
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AllowedHoursWindow {
    @Builder.Default
    boolean enabled = true;
    int startHour;
    @Builder.Default
    int endHour = 24;
    @Builder.Default
    List<String> days = List.of();
    
    /**
     * Окно действительно что-то ограничивает (не 24/7)
     */
    public boolean restricted() {
        if (!enabled) {
            return false;
        }
        boolean wholeDay = startHour == endHour || (startHour <= 0 && endHour >= 24);
        boolean allDays = days == null || days.isEmpty() || days.size() >= 7;
        return !(wholeDay && allDays);
    }
}
