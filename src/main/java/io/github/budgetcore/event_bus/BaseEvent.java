package io.github.budgetcore.event_bus;

import io.github.budgetcore.UuidProvider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public class BaseEvent implements Event {
    public static final String DEFAULT_VERSION = "1.0";

    private final String id;
    private final String type;
    private final Object data;
    private final Instant timestamp;
    private final String source;
    private final String version;
    private final Map<String, Object> metadata;

    public BaseEvent(@NotNull String type, @NotNull String source, @Nullable Object data) {
        this(type, source, data, Collections.emptyMap());
    }

    public BaseEvent(@NotNull String type, @NotNull String source, @Nullable Object data, @NotNull Map<String, Object> metadata) {
        this.id = UuidProvider.generatePrefixedId("evt");
        this.type = Objects.requireNonNull(type, "type");
        this.source = Objects.requireNonNull(source, "source");
        this.data = data;
        this.timestamp = Instant.now();
        this.version = DEFAULT_VERSION;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(metadata, "metadata")));
    }

    @Override
    public @NotNull String getId() {
        return id;
    }

    @Override
    public @NotNull String getType() {
        return type;
    }

    @Override
    public @Nullable Object getData() {
        return data;
    }

    @Override
    public @NotNull Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public @NotNull String getSource() {
        return source;
    }

    @Override
    public @NotNull String getVersion() {
        return version;
    }

    @Override
    public @NotNull Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "Event{id=" + id + ", type=" + type + ", source=" + source + ", timestamp=" + timestamp + '}';
    }
}
