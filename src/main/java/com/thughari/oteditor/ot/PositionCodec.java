package com.thughari.oteditor.ot;

import com.thughari.oteditor.model.Position;

/**
 * Folds a (line, column) pair into one sortable index as {@code line * columnsPerLine + column}.
 * <p>
 * The encoding is exact only while every column stays below {@code columnsPerLine}; a longer line
 * bleeds into the index range of the next one. Callers can check {@link #fits(Position)}.
 */
public final class PositionCodec {

    public static final int DEFAULT_COLUMNS_PER_LINE = 1000;

    private final int columnsPerLine;

    public PositionCodec() {
        this(DEFAULT_COLUMNS_PER_LINE);
    }

    public PositionCodec(int columnsPerLine) {
        if (columnsPerLine <= 0) {
            throw new IllegalArgumentException("columnsPerLine must be positive: " + columnsPerLine);
        }
        this.columnsPerLine = columnsPerLine;
    }

    public int columnsPerLine() {
        return columnsPerLine;
    }

    public long toIndex(Position position) {
        return (long) position.getLine() * columnsPerLine + position.getColumn();
    }

    public Position toPosition(long index) {
        return Position.of((int) (index / columnsPerLine), (int) (index % columnsPerLine));
    }

    /** Shifts by {@code offset}, clamping at the document start. */
    public Position adjust(Position position, long offset) {
        return toPosition(Math.max(0, toIndex(position) + offset));
    }

    public boolean fits(Position position) {
        return position.getLine() >= 0 && position.getColumn() >= 0 && position.getColumn() < columnsPerLine;
    }
}
