package org.calista.credence.claim;

import java.time.Instant;
import java.util.Objects;

/**
 * Evidence — immutable reference to something a claim rests on. Claims point at
 * evidence by id; many claims may share one piece of evidence.
 *
 * @param expiresAt null means it never expires
 */
public record Evidence(String id, String source, Instant createdAt, Instant expiresAt) {

    public Evidence {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(createdAt, "createdAt");
        if (id.isBlank()) throw new IllegalArgumentException("evidence id must not be blank");
        source = (source == null) ? "" : source.trim();
        if (expiresAt != null && expiresAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("evidence " + id + " expires before it was created");
        }
    }

    public static Evidence of(String id, String source, Instant createdAt) {
        return new Evidence(id, source, createdAt, null);
    }

    public boolean isExpired(Instant now) {
        Objects.requireNonNull(now, "now");
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
