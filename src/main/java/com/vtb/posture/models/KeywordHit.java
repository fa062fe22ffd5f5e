package com.vtb.posture.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Сколько записей журнала содержат ключевое слово (каждая запись считается один раз)
 */
@Value
@Builder
@Jacksonized
public class KeywordHit {
    String keyword;
    long occurrences;
    long inHeaders;
    long inBody;
    double percentage;
}
