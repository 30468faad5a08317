package com.vidnyan.rva.domain.semantics;

/**
 * Outcome of classifying one member type.
 * Immutable value object.
 *
 * @param status                the outcome
 * @param innerTypeDisplayName  for {@link Status#NESTED_FAILED}, the display name of the
 *                              immediate failing child type; null otherwise
 */
public record Verdict(Status status, String innerTypeDisplayName) {

    public enum Status {
        OK,
        FAILED,
        NESTED_FAILED
    }

    private static final Verdict OK = new Verdict(Status.OK, null);
    private static final Verdict FAILED = new Verdict(Status.FAILED, null);

    public static Verdict ok() {
        return OK;
    }

    public static Verdict failed() {
        return FAILED;
    }

    public static Verdict nestedFailed(String innerTypeDisplayName) {
        return new Verdict(Status.NESTED_FAILED, innerTypeDisplayName);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isNested() {
        return status == Status.NESTED_FAILED;
    }
}
