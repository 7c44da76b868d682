package com.luauprinter.cst;

import com.luauprinter.InternalConsistencyException;
import com.luauprinter.ast.SourceLocation.Position;

import java.util.List;

/**
 * Raw source text of every segment of an interpolated string, and the position
 * of the delimiter that opens each segment: the backtick for the first one and
 * the closing brace of the preceding expression for the rest.
 */
public record CstInterpString(
    List<String> sourceStrings,
    List<Position> stringPositions
) implements CstNode {

    public CstInterpString {
        sourceStrings = CstLists.copy(sourceStrings, "sourceStrings");
        stringPositions = CstLists.copy(stringPositions, "stringPositions");
        if (sourceStrings.size() != stringPositions.size()) {
            throw new InternalConsistencyException("interpolated string has " + sourceStrings.size()
                + " segments but " + stringPositions.size() + " segment positions");
        }
    }

    @Override
    public CstKind cstKind() {
        return CstKind.INTERP_STRING;
    }
}
