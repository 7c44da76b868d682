package com.luauprinter.printer;

import com.luauprinter.InternalConsistencyException;
import com.luauprinter.ast.SourceLocation.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes the separators of a list: nothing before the first element and a
 * separator before each later one, placed at recorded positions when there
 * are any.
 */
public final class Separators {

    private final List<Anchor> anchors;  // null: every separator is inline
    private int next;
    private boolean first = true;

    private Separators(List<Anchor> anchors) {
        this.anchors = anchors;
    }

    public static Separators inline() {
        return new Separators(null);
    }

    public static Separators at(List<Position> positions) {
        List<Anchor> anchors = new ArrayList<>(positions.size());
        for (Position position : positions) {
            anchors.add(Anchor.at(position));
        }
        return new Separators(anchors);
    }

    public static Separators anchored(List<Anchor> anchors) {
        return new Separators(anchors);
    }

    /**
     * Called before each element.
     */
    public void insert(SourceWriter writer, String separator) {
        if (first) {
            first = false;
            return;
        }
        nextAnchor().place(writer);
        writer.symbol(separator);
    }

    /**
     * Writes a separator unconditionally, as between a type list and its tail.
     */
    public void force(SourceWriter writer, String separator) {
        first = false;
        nextAnchor().place(writer);
        writer.symbol(separator);
    }

    private Anchor nextAnchor() {
        if (anchors == null) {
            return Anchor.INLINE;
        }
        if (next >= anchors.size()) {
            throw new InternalConsistencyException(
                "separator " + (next + 1) + " requested but only " + anchors.size() + " recorded");
        }
        return anchors.get(next++);
    }
}
