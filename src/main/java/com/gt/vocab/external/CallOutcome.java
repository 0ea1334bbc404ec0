package com.gt.vocab.external;

public record CallOutcome<T>(Status status, T value, Throwable error) {

    public enum Status {
        SUCCESS,
        TIMEOUT,
        ERROR
    }

    public static <T> CallOutcome<T> success(T value) {
        return new CallOutcome<>(Status.SUCCESS, value, null);
    }

    public static <T> CallOutcome<T> timeout() {
        return new CallOutcome<>(Status.TIMEOUT, null, null);
    }

    public static <T> CallOutcome<T> error(Throwable error) {
        return new CallOutcome<>(Status.ERROR, null, error);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
