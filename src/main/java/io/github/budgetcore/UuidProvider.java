package io.github.budgetcore;

import org.jetbrains.annotations.NotNull;

import java.util.UUID;

/**
 * Identifiers of jobs, tasks, events and subscriptions.
 */
public final class UuidProvider {

    private UuidProvider() {
    }

    /**
     * Generates a prefixed identifier, e.g. {@code task_1b4e28ba2fa14f1e9c1d1c2a0b7f3e55}.
     *
     * @param prefix short tag describing the kind of record
     * @return {@code prefix + "_" + 32 hex chars}
     */
    public static @NotNull String generatePrefixedId(@NotNull String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "");
    }
}
