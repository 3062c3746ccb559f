package org.csu.spl.compiler.ast;

import java.util.Objects;

final class Checks {

    private Checks() {
    }

    static int line(int line) {
        if (line < 0) {
            throw new IllegalArgumentException("line must not be negative: " + line);
        }
        return line;
    }

    static String name(String value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
