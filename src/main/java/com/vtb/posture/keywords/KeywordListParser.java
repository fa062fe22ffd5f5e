package com.vtb.posture.keywords;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Разбор плоского списка ключевых слов.
 *
 * Слова разделяются запятыми или переводами строки. Строки, начинающиеся с #,
 * считаются комментариями. Результат в нижнем регистре, без повторов, отсортирован.
 */
public final class KeywordListParser {

    private KeywordListParser() {
    }

    public static List<String> parse(String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        TreeSet<String> keywords = new TreeSet<>();
        for (String line : content.split("\\r?\\n")) {
            String trimmedLine = line.trim();
            if (trimmedLine.isEmpty() || trimmedLine.startsWith("#")) {
                continue;
            }
            for (String token : trimmedLine.split(",")) {
                String keyword = token.trim().toLowerCase(Locale.ROOT);
                if (!keyword.isEmpty()) {
                    keywords.add(keyword);
                }
            }
        }
        return new ArrayList<>(keywords);
    }
}
