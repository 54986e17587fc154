package com.repo.formulas.parser;

import java.util.List;

/**
 * Outcome of {@link FormulaParser#validateFormulaSyntax(String)}.
 */
public record SyntaxValidation(boolean valid, List<String> errors) {

    public SyntaxValidation {
        errors = List.copyOf(errors);
    }

    public static SyntaxValidation of(List<String> errors) {
        return new SyntaxValidation(errors.isEmpty(), errors);
    }
}
