package io.github.budgetcore.worker_pool;

import io.github.budgetcore.UuidProvider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * A unit of work for the {@link WorkerPool}. Immutable once built.
 * <p>
 * {@code priority} is advisory metadata (higher = sooner); the pool serves jobs in FIFO order.
 */
public final class Job {
    private final String id;
    private final String type;
    private final Object payload;
    private final int priority;
    private final Instant created;

    private Job(Builder b) {
        this.id = b.id != null ? b.id : UuidProvider.generatePrefixedId("job");
        this.type = Objects.requireNonNull(b.type, "type");
        this.payload = b.payload;
        this.priority = b.priority;
        this.created = b.created != null ? b.created : Instant.now();
    }

    public static @NotNull Job of(@NotNull String type, @Nullable Object payload) {
        return new Builder().type(type).payload(payload).build();
    }

    public static @NotNull Builder builder() {
        return new Builder();
    }

    public @NotNull String getId() {
        return id;
    }

    public @NotNull String getType() {
        return type;
    }

    public @Nullable Object getPayload() {
        return payload;
    }

    public int getPriority() {
        return priority;
    }

    public @NotNull Instant getCreated() {
        return created;
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", type=" + type + ", priority=" + priority + ", created=" + created + '}';
    }

    public static final class Builder {
        private String id;
        private String type;
        private Object payload;
        private int priority;
        private Instant created;

        /**
         * Optional; a {@code job_...} id is generated when omitted.
         */
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder payload(Object payload) {
            this.payload = payload;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        /**
         * Optional; defaults to the build time.
         */
        public Builder created(Instant created) {
            this.created = created;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }
}
