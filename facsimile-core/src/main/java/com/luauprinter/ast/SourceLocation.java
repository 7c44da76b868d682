package com.luauprinter.ast;

/**
 * A begin/end range in the source text. Lines and columns are 0-based; the end is exclusive.
 */
public record SourceLocation(Position start, Position end) {

    public static final SourceLocation NONE = new SourceLocation(Position.ORIGIN, Position.ORIGIN);

    public SourceLocation {
        if (start == null || end == null) {
            throw new IllegalArgumentException("location bounds must not be null");
        }
    }

    public static SourceLocation of(int startLine, int startColumn, int endLine, int endColumn) {
        return new SourceLocation(new Position(startLine, startColumn), new Position(endLine, endColumn));
    }

    public static SourceLocation span(SourceLocation from, SourceLocation to) {
        return new SourceLocation(from.start(), to.end());
    }

    public boolean contains(Position position) {
        return start.compareTo(position) <= 0 && position.compareTo(end) < 0;
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }

    public record Position(int line, int column) implements Comparable<Position> {

        public static final Position ORIGIN = new Position(0, 0);

        public Position shiftColumn(int delta) {
            return new Position(line, column + delta);
        }

        @Override
        public int compareTo(Position other) {
            if (line != other.line) {
                return Integer.compare(line, other.line);
            }
            return Integer.compare(column, other.column);
        }

        @Override
        public String toString() {
            return "(" + line + "," + column + ")";
        }
    }
}
