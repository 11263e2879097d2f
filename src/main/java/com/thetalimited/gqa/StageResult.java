package com.thetalimited.gqa;

import java.util.Objects;

/**
 * Outcome of one pipeline stage: either a value or the captured failure
 * message that ends up in the report.
 */
public final class StageResult<T>
{
    private final T value;
    private final String failure;

    private StageResult(T value, String failure)
    {
        this.value = value;
        this.failure = failure;
    }

    public static <T> StageResult<T> success(T value)
    {
        return new StageResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> StageResult<T> failure(String message)
    {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("A failed stage needs a message");
        }
        return new StageResult<>(null, message);
    }

    public boolean isSuccess() { return failure == null; }

    public T getValue()
    {
        if (failure != null) {
            throw new IllegalStateException("Stage failed: " + failure);
        }
        return value;
    }

    public String getFailure()
    {
        if (failure == null) {
            throw new IllegalStateException("Stage succeeded");
        }
        return failure;
    }

    @Override
    public String toString()
    {
        return isSuccess() ? "success(" + value + ")" : "failure(" + failure + ")";
    }
}
