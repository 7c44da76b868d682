package com.luauprinter;

import com.luauprinter.ast.Block;
import com.luauprinter.cst.CstNodeMap;

import java.util.List;

/**
 * Outcome of a parse. {@code root} is null when there are errors.
 */
public record ParseResult(Block root, List<ParseError> errors, CstNodeMap cstNodeMap) {

    public ParseResult {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
