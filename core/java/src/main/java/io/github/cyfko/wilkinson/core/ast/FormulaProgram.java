package io.github.cyfko.wilkinson.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Result of parsing: the main formula followed by its auxiliary entries.
 *
 * @param main    the main formula
 * @param entries parameter formulas and assignments in textual order
 * @since 1.0.0
 */
public record FormulaProgram(Formula main, List<ProgramEntry> entries) {

    public FormulaProgram {
        Objects.requireNonNull(main, "main");
        entries = List.copyOf(entries);
    }
}
