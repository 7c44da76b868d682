package com.luauprinter.printer;

import com.luauprinter.ast.SourceLocation;
import com.luauprinter.ast.SourceLocation.Position;

/**
 * Where the next token goes relative to what has been written so far.
 */
public sealed interface Anchor {

    /** Directly after the previous token. */
    Anchor INLINE = new Inline();

    /** After a single space. */
    Anchor SPACE = new Space();

    /** The token is not written at all. */
    Anchor OMIT = new Omit();

    void place(SourceWriter writer);

    default boolean omitted() {
        return false;
    }

    static Anchor at(Position position) {
        return new At(position);
    }

    /**
     * Anchors at {@code position}, or omits the token when there is no
     * recorded position for it.
     */
    static Anchor atOrOmit(Position position) {
        return position == null ? OMIT : new At(position);
    }

    static Anchor spaced(Position next, int reserve) {
        return new Spaced(next, reserve);
    }

    /**
     * Estimated position of a closing keyword of {@code width} characters that
     * ends the construct at {@code location}.
     */
    static Anchor before(SourceLocation location, int width) {
        Position end = location.end();
        return new At(end.column() >= width ? end.shiftColumn(-width) : end);
    }

    record At(Position position) implements Anchor {
        @Override
        public void place(SourceWriter writer) {
            writer.advance(position);
        }
    }

    record Spaced(Position next, int reserve) implements Anchor {
        @Override
        public void place(SourceWriter writer) {
            writer.maybeSpace(next, reserve);
        }
    }

    final class Inline implements Anchor {
        private Inline() {
        }

        @Override
        public void place(SourceWriter writer) {
        }
    }

    final class Space implements Anchor {
        private Space() {
        }

        @Override
        public void place(SourceWriter writer) {
            writer.space();
        }
    }

    final class Omit implements Anchor {
        private Omit() {
        }

        @Override
        public void place(SourceWriter writer) {
        }

        @Override
        public boolean omitted() {
            return true;
        }
    }
}
