package com.thughari.oteditor.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A caret location inside a document, zero-based on both axes.
 * Ordered line-major, column-minor.
 */
@Value
@Builder
@Jacksonized
public class Position implements Comparable<Position> {

    public static final Position ORIGIN = new Position(0, 0);

    int line;
    int column;

    public static Position of(int line, int column) {
        return new Position(line, column);
    }

    @Override
    public int compareTo(Position other) {
        int byLine = Integer.compare(line, other.line);
        return byLine != 0 ? byLine : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return "(" + line + "," + column + ")";
    }
}
