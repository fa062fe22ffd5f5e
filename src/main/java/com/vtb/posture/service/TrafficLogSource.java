package com.vtb.posture.service;

import com.vtb.posture.models.TimeRange;
import com.vtb.posture.models.TrafficSample;

import java.time.ZoneId;

/**
 * Хранилище журналов трафика.
 *
 * Таймауты, повторы и ограничение объема выборки реализуются здесь,
 * движок оценки получает уже готовую выборку.
 */
public interface TrafficLogSource {

    /**
     * Записи эндпоинта за период (даты периода в поясе zone)
     *
     * @throws TrafficSourceException если хранилище недоступно
     */
    TrafficSample fetch(String endpointId, TimeRange range, ZoneId zone);
}
