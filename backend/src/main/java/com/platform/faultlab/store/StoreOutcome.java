package com.platform.faultlab.store;

/**
 * Result of a single store driver call: either a value or an error message.
 */
public record StoreOutcome<T>(boolean success, T value, String error) {

    public static <T> StoreOutcome<T> ok(T value) {
        return new StoreOutcome<>(true, value, null);
    }

    public static StoreOutcome<Void> ok() {
        return new StoreOutcome<>(true, null, null);
    }

    public static <T> StoreOutcome<T> failed(String error) {
        return new StoreOutcome<>(false, null, error);
    }

    public static <T> StoreOutcome<T> failed(Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new StoreOutcome<>(false, null, message);
    }

    public boolean isFailure() {
        return !success;
    }
}
