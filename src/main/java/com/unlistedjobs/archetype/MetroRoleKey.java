package com.unlistedjobs.archetype;

import java.util.Objects;

/**
 * Immutable identity of one labor-market cell: a metro area and a canonical role.
 * <p>
 * Produced by the prior provider and consumed by both estimators. The key also seeds the
 * per-cell Monte Carlo generator, so {@link #stableHash()} must not depend on JVM identity hashing.
 *
 * @param metroAreaId     OEWS area code of the metro area (e.g. "14460")
 * @param canonicalRoleId id of the canonical role the OEWS occupation maps onto
 */
public record MetroRoleKey(String metroAreaId, int canonicalRoleId) {

    public MetroRoleKey {
        Objects.requireNonNull(metroAreaId, "metroAreaId");
        if (metroAreaId.isBlank()) {
            throw new IllegalArgumentException("metroAreaId cannot be blank");
        }
        metroAreaId = metroAreaId.trim();
    }

    /**
     * Deterministic 64-bit hash of the key (FNV-1a over the area code, mixed with the role id).
     * @return hash stable across JVM runs
     */
    public long stableHash() {
        long h = 0xcbf29ce484222325L;
        for (int i = 0; i < metroAreaId.length(); i++) {
            h ^= metroAreaId.charAt(i);
            h *= 0x100000001b3L;
        }
        h ^= canonicalRoleId;
        h *= 0x100000001b3L;
        return h;
    }

    @Override
    public String toString() {
        return metroAreaId + "x" + canonicalRoleId;
    }
}
