package com.entity.research.cache;

import com.entity.research.core.model.Fingerprints;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Identifies one fetch of one resource. Parameters are normalized (keys lowercased,
 * string values trimmed, order ignored) and reduced to a digest, so equivalent
 * requests share an entry.
 *
 * @param target     target key of the external system
 * @param operation  name of the request, e.g. {@code filing-index}
 * @param paramsHash digest of the normalized parameters
 * @param idempotent false for requests with side effects; those bypass the cache
 */
public record CacheKey(String target, String operation, String paramsHash, boolean idempotent) {

    public CacheKey {
        Objects.requireNonNull(target, "target is required");
        Objects.requireNonNull(operation, "operation is required");
        Objects.requireNonNull(paramsHash, "paramsHash is required");
    }

    public static CacheKey of(String target, String operation, Map<String, ?> params) {
        return new CacheKey(target.trim().toLowerCase(Locale.ROOT), operation, digest(params), true);
    }

    public static CacheKey nonIdempotent(String target, String operation, Map<String, ?> params) {
        return new CacheKey(target.trim().toLowerCase(Locale.ROOT), operation, digest(params), false);
    }

    private static String digest(Map<String, ?> params) {
        Map<String, Object> normalized = new TreeMap<>();
        if (params != null) {
            params.forEach((k, v) -> {
                if (v != null) {
                    normalized.put(k.trim().toLowerCase(Locale.ROOT), v instanceof String s ? s.trim() : v);
                }
            });
        }
        return Fingerprints.of(normalized);
    }
}
