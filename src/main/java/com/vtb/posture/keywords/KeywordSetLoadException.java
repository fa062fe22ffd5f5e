package com.vtb.posture.keywords;

/**
 * Набор ключевых слов не удалось прочитать или он пуст
 */
public class KeywordSetLoadException extends RuntimeException {

    private final String source;

    public KeywordSetLoadException(String source, String message) {
        super(message);
        this.source = source;
    }

    public KeywordSetLoadException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
