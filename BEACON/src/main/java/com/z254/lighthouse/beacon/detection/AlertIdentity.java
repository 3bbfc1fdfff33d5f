package com.z254.lighthouse.beacon.detection;

import com.z254.lighthouse.beacon.domain.model.AlertType;
import com.z254.lighthouse.beacon.domain.model.Entity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Deterministic alert identifier.
 * <p>
 * The alert type code, the entity type code and the entity coordinates (product, market,
 * campaign, ad group, then keyword or the URL when there is no keyword) are joined with
 * {@code ":"}, skipping absent or empty parts. The identifier is the first
 * 16 hex characters of the MD5 digest of the UTF-8 bytes.
 */
public final class AlertIdentity {

    private static final int ID_LENGTH = 16;

    private AlertIdentity() {
    }

    public static String of(AlertType type, Entity entity) {
        return fingerprint(canonicalKey(type, entity));
    }

    static String canonicalKey(AlertType type, Entity entity) {
        String entityType = entity.getType() != null ? entity.getType().getCode() : null;
        String leaf = entity.getKeyword() != null && !entity.getKeyword().isEmpty()
                ? entity.getKeyword()
                : entity.getUrl();
        return Stream.of(type.getCode(), entityType, entity.getProduct(), entity.getMarket(),
                        entity.getCampaign(), entity.getAdGroup(), leaf)
                .filter(Objects::nonNull)
                .filter(part -> !part.isEmpty())
                .collect(Collectors.joining(":"));
    }

    static String fingerprint(String key) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] digest = md5.digest(key.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 digest unavailable", e);
        }
    }
}
