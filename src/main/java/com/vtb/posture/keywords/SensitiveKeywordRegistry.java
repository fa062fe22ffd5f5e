package com.vtb.posture.keywords;

import com.vtb.posture.models.SensitiveKeywordSet;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Хранилище действующего набора чувствительных ключевых слов.
 *
 * Набор меняется только целиком через атомарную ссылку: прогон оценки берет
 * снимок один раз и не видит перезагрузок, случившихся во время работы.
 * Чтение снимка не блокируется, загрузки сериализованы.
 */
@Slf4j
public class SensitiveKeywordRegistry {

    public static final String CLASSPATH_PREFIX = "classpath:";

    private final String source;
    private final AtomicReference<SensitiveKeywordSet> current = new AtomicReference<>();

    public SensitiveKeywordRegistry(String source) {
        this.source = source;
    }

    /**
     * Первичная загрузка при старте
     *
     * @throws KeywordSetLoadException если источник недоступен или пуст
     */
    public synchronized SensitiveKeywordSet initialize() {
        SensitiveKeywordSet loaded = load(1L);
        current.set(loaded);
        log.info("Загружен словарь чувствительных данных: {} слов из {}", loaded.size(), source);
        return loaded;
    }

    /**
     * Перечитать источник. При ошибке остается прежний набор.
     * Перезагрузки выполняются по одной, каждая успешная получает свою версию.
     */
    public synchronized ReloadOutcome reload() {
        SensitiveKeywordSet previous = current.get();
        long nextVersion = previous != null ? previous.getVersion() + 1 : 1L;
        try {
            SensitiveKeywordSet loaded = load(nextVersion);
            current.set(loaded);
            log.info("Словарь перезагружен: версия {}, {} слов", loaded.getVersion(), loaded.size());
            return ReloadOutcome.builder()
                .success(true)
                .activeVersion(loaded.getVersion())
                .keywordCount(loaded.size())
                .source(source)
                .build();
        } catch (KeywordSetLoadException e) {
            log.warn("Не удалось перезагрузить словарь из {}, остается версия {}: {}",
                source, previous != null ? previous.getVersion() : 0, e.getMessage());
            return ReloadOutcome.builder()
                .success(false)
                .activeVersion(previous != null ? previous.getVersion() : 0)
                .keywordCount(previous != null ? previous.size() : 0)
                .source(source)
                .error(e.getMessage())
                .build();
        }
    }

    /**
     * Текущий снимок
     *
     * @throws IllegalStateException если словарь еще не загружен
     */
    public SensitiveKeywordSet current() {
        SensitiveKeywordSet snapshot = current.get();
        if (snapshot == null) {
            throw new IllegalStateException("Словарь чувствительных данных не инициализирован");
        }
        return snapshot;
    }

    public String getSource() {
        return source;
    }

    private SensitiveKeywordSet load(long version) {
        if (source == null || source.isBlank()) {
            throw new KeywordSetLoadException(source, "Источник словаря не задан");
        }
        List<String> keywords = KeywordListParser.parse(readSource());
        if (keywords.isEmpty()) {
            throw new KeywordSetLoadException(source, "Словарь пуст: " + source);
        }
        return SensitiveKeywordSet.of(version, source, keywords);
    }

    private String readSource() {
        if (source.startsWith(CLASSPATH_PREFIX)) {
            String resource = source.substring(CLASSPATH_PREFIX.length());
            try (InputStream is = SensitiveKeywordRegistry.class.getClassLoader().getResourceAsStream(resource)) {
                if (is == null) {
                    throw new KeywordSetLoadException(source, resource + " не найден в classpath");
                }
                return new String(is.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new KeywordSetLoadException(source, "Ошибка чтения " + source + ": " + e.getMessage(), e);
            }
        }
        Path path = Path.of(source);
        if (!Files.isReadable(path)) {
            throw new KeywordSetLoadException(source, "Файл словаря недоступен: " + path.toAbsolutePath());
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new KeywordSetLoadException(source, "Ошибка чтения " + path + ": " + e.getMessage(), e);
        }
    }
}
