package com.vtb.posture.share;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.posture.models.ScoreReport;
import com.vtb.posture.reports.JsonReportGenerator;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

/**
 * Share-ссылки на снимок отчета.
 *
 * Отчет сохраняется как есть, по ссылке возвращается тот же отчет,
 * а не пересчитанный. Токен: 24 случайных байта в URL-safe Base64.
 */
@Slf4j
public class ShareLinkService {

    static final int TOKEN_BYTES = 24;
    public static final String SHARED_PATH = "/api/v1/shared/";

    private final ShareSnapshotStore store;
    private final ObjectMapper mapper = JsonReportGenerator.createMapper();
    private final SecureRandom random = new SecureRandom();

    public ShareLinkService(ShareSnapshotStore store) {
        this.store = store;
    }

    public ShareLink share(ScoreReport report) {
        if (report == null) {
            throw new IllegalArgumentException("ScoreReport не может быть null");
        }
        String json;
        try {
            json = mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Не удалось сериализовать отчет: " + e.getMessage(), e);
        }
        String token = newToken();
        while (store.contains(token)) {
            token = newToken();
        }
        ShareLink link = ShareLink.builder()
            .token(token)
            .endpointId(report.getEndpointId())
            .path(SHARED_PATH + token)
            .expiresAt(store.put(token, json))
            .build();
        log.info("Создана share-ссылка для {} до {}", report.getEndpointId(), link.getExpiresAt());
        return link;
    }

    /**
     * Отчет по токену; пусто для неизвестного или просроченного токена
     */
    public Optional<ScoreReport> resolve(String token) {
        Optional<String> json = store.get(token);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(json.get(), ScoreReport.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Поврежденный share-снимок " + token + ": " + e.getMessage(), e);
        }
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
