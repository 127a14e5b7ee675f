package io.github.budgetcore.domain;

import io.github.budgetcore.base_exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;

import java.time.Month;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Objects;

/**
 * Budget period: one calendar month between 1970 and 3000.
 */
public final class YearMonth {
    public static final int MIN_YEAR = 1970;
    public static final int MAX_YEAR = 3000;

    private final int year;
    private final int month;

    private YearMonth(int year, int month) {
        this.year = year;
        this.month = month;
    }

    public static @NotNull YearMonth of(int year, int month) throws ValidationException {
        validate(year, month);
        return new YearMonth(year, month);
    }

    public static void validate(int year, int month) throws ValidationException {
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new ValidationException("invalid year " + year + ", expected " + MIN_YEAR + ".." + MAX_YEAR);
        }
        if (month < 1 || month > 12) {
            throw new ValidationException("invalid month " + month + ", expected 1..12");
        }
    }

    public int getYear() {
        return year;
    }

    public int getMonth() {
        return month;
    }

    /**
     * English month name, e.g. "March".
     */
    public @NotNull String monthName() {
        return Month.of(month).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof YearMonth)) return false;
        YearMonth that = (YearMonth) o;
        return year == that.year && month == that.month;
    }

    @Override
    public int hashCode() {
        return Objects.hash(year, month);
    }

    @Override
    public String toString() {
        return String.format("%04d-%02d", year, month);
    }
}
