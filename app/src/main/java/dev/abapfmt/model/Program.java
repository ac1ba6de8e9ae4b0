package dev.abapfmt.model;

import java.util.List;
import java.util.Objects;

/**
 * The statements of one source document, in source order.
 */
public record Program(String fileName, List<Statement> statements) {

    public Program {
        Objects.requireNonNull(fileName, "fileName");
        statements = List.copyOf(Objects.requireNonNull(statements, "statements"));
    }
}
