package com.repo.formulas.parser;

import java.util.List;

/**
 * A function call found in formula text.
 */
public record FunctionCall(
        /** Upper-cased name with Excel's storage prefixes removed */
        String name,

        /** Raw argument expressions split at top-level commas */
        List<String> parameters,

        /** Number of unmatched open parentheses before the call */
        int nestingLevel,

        /** Static weight from the {@link FunctionCatalog} */
        double complexityWeight,

        int startPos,
        int endPos) {

    public FunctionCall {
        parameters = List.copyOf(parameters);
    }

    public int parameterCount() {
        return parameters.size();
    }
}
