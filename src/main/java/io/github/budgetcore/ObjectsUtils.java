package io.github.budgetcore;

import org.jetbrains.annotations.NotNull;

public final class ObjectsUtils {

    private ObjectsUtils() {
    }

    /**
     * Throws the supplied exception when {@code object} is null.
     */
    public static <T, E extends RuntimeException> @NotNull T requireNonNull(T object, @NotNull E exception) {
        if (object == null) throw exception;
        return object;
    }

    public static <E extends RuntimeException> void requireTrue(boolean condition, @NotNull E exception) {
        if (!condition) throw exception;
    }
}
