package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

import java.util.List;

/**
 * Items of a table type in source order, so that an indexer written between
 * properties is printed where it was. {@code array} marks the {@code {T}}
 * shorthand, which has no items.
 */
public record CstTableType(
    List<Item> items,
    boolean array
) implements CstNode {

    public CstTableType {
        items = CstLists.copy(items, "items");
    }

    public record Item(
        Kind itemKind,
        Position indexerOpenPosition,       // Can be null
        Position indexerClosePosition,      // Can be null
        Position colonPosition,
        Separator separator,                // Can be null
        Position separatorPosition,         // Can be null
        CstConstantString stringInfo,       // STRING_PROPERTY only
        Position stringPosition             // STRING_PROPERTY only
    ) {

        public enum Kind {
            INDEXER,
            PROPERTY,
            STRING_PROPERTY
        }
    }

    @Override
    public CstKind cstKind() {
        return CstKind.TABLE_TYPE;
    }
}
