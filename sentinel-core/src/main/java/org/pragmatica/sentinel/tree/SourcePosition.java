package org.pragmatica.sentinel.tree;

/// Location token attached to a node by the front end. The engine passes it through unexamined.
public record SourcePosition(int line, int column) implements Comparable<SourcePosition> {
    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

    public static SourcePosition sourcePosition(int line, int column) {
        return new SourcePosition(line, column);
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public int compareTo(SourcePosition other) {
        return line != other.line
               ? Integer.compare(line, other.line)
               : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
