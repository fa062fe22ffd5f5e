package com.vtb.posture.share;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Выданная share-ссылка
 */
@Value
@Builder
public class ShareLink {
    String token;
    String endpointId;
    String path;
    Instant expiresAt;
}
