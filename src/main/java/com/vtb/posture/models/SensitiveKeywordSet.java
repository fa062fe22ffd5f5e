package com.vtb.posture.models;

import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.TreeSet;
import java.util.SortedSet;

/**
 * Неизменяемый снимок набора чувствительных ключевых слов.
 * Заменяется целиком при перезагрузке, частичных состояний не бывает.
 */
@Value
public class SensitiveKeywordSet {
    long version;
    String source;
    SortedSet<String> keywords;
    
    private SensitiveKeywordSet(long version, String source, SortedSet<String> keywords) {
        this.version = version;
        this.source = source;
        this.keywords = keywords;
    }
    
    public static SensitiveKeywordSet of(long version, String source, Collection<String> keywords) {
        TreeSet<String> normalized = new TreeSet<>();
        if (keywords != null) {
            for (String keyword : keywords) {
                if (keyword == null) {
                    continue;
                }
                String trimmed = keyword.trim().toLowerCase(Locale.ROOT);
                if (!trimmed.isEmpty()) {
                    normalized.add(trimmed);
                }
            }
        }
        return new SensitiveKeywordSet(version, source, Collections.unmodifiableSortedSet(normalized));
    }
    
    public int size() {
        return keywords.size();
    }
}
