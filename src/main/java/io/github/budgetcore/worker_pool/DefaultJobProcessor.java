package io.github.budgetcore.worker_pool;

import com.google.errorprone.annotations.ThreadSafe;
import io.github.budgetcore.CancellationToken;
import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatches jobs to a handler registered for their type tag.
 */
@ThreadSafe
public class DefaultJobProcessor implements JobProcessor {
    private final Map<String, JobProcessor> handlers = new ConcurrentHashMap<>();

    /**
     * Registers (or replaces) the handler for {@code jobType}.
     */
    public DefaultJobProcessor register(@NotNull String jobType, @NotNull JobProcessor handler) {
        handlers.put(Objects.requireNonNull(jobType, "jobType"), Objects.requireNonNull(handler, "handler"));
        return this;
    }

    public boolean unregister(@NotNull String jobType) {
        return handlers.remove(jobType) != null;
    }

    public @NotNull Set<String> registeredTypes() {
        return Set.copyOf(handlers.keySet());
    }

    @Override
    public Object process(Job job, CancellationToken token) throws Exception {
        JobProcessor handler = handlers.get(job.getType());
        if (handler == null) {
            throw new IllegalArgumentException("no handler registered for job type: " + job.getType());
        }
        return handler.process(job, token);
    }
}
