package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;
import com.luauprinter.ast.TableItem;

import java.util.List;

public record CstTable(List<Item> items) implements CstNode {

    public CstTable {
        items = CstLists.copy(items, "items");
    }

    /**
     * Punctuation around one table item. The separator is null for the last
     * item when it has no trailing separator.
     */
    public record Item(
        TableItem.Kind itemKind,
        Position indexerOpenPosition,   // Can be null
        Position indexerClosePosition,  // Can be null
        Position equalsPosition,        // Can be null
        Separator separator,            // Can be null
        Position separatorPosition      // Can be null
    ) {
    }

    @Override
    public CstKind cstKind() {
        return CstKind.TABLE;
    }
}
