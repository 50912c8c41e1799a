package com.e2eq.hooks.model.base;

import dev.morphia.annotations.Id;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.util.UUID;

/**
 * Common identity for every persisted pipeline and authorization record.
 * Ids are opaque strings so references survive renames of the referenced record.
 */
@Data
@NoArgsConstructor
@SuperBuilder
public abstract class HookBaseModel {

    @Id
    protected String id;

    protected Instant createdAt;

    /**
     * Assign an id and creation time if the record does not carry them yet.
     */
    public void ensureIdentity(Instant now) {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = now;
        }
    }
}
