package io.github.flameyossnowy.linkage.api.exceptions;

import org.jetbrains.annotations.NotNull;

public class TypeMismatchException extends RepositoryException {
    private final Class<?> expected;

    public TypeMismatchException(@NotNull Class<?> expected, Object actual) {
        super(expected.getName() + " expected, got " + describe(actual));
        this.expected = expected;
    }

    private static String describe(Object actual) {
        return actual == null ? "null" : actual + " which is an instance of " + actual.getClass().getName();
    }

    public Class<?> getExpected() {
        return expected;
    }
}
