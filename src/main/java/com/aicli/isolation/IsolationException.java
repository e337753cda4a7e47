package com.aicli.isolation;

/**
 * Thrown when an isolation, resource or network request is rejected.
 *
 * <p>{@link Category#INVALID_INPUT} covers missing or malformed arguments;
 * {@link Category#POLICY_VIOLATION} covers well-formed values that break a configured rule
 * (blocked port, memory floor, swap below memory).
 */
public class IsolationException extends RuntimeException {

    public enum Category { INVALID_INPUT, POLICY_VIOLATION }

    private final Category category;

    public IsolationException(Category category, String message) {
        super(message);
        this.category = category;
    }

    public IsolationException(Category category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public static IsolationException invalidInput(String message) {
        return new IsolationException(Category.INVALID_INPUT, message);
    }

    public static IsolationException policyViolation(String message) {
        return new IsolationException(Category.POLICY_VIOLATION, message);
    }

    public Category getCategory() {
        return category;
    }
}
