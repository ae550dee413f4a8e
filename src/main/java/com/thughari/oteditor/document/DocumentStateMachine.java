package com.thughari.oteditor.document;

import com.thughari.oteditor.model.Operation;
import com.thughari.oteditor.model.SharedDocument;
import com.thughari.oteditor.ot.PositionCodec;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Applies one operation at a time to a {@link SharedDocument}. Out-of-range positions are
 * recovered locally (inserts grow the document, deletes become no-ops); nothing is rejected.
 */
@Slf4j
public class DocumentStateMachine {

    private static final int LARGE_LINE_GROWTH = 10_000;

    private final PositionCodec codec;
    private final Clock clock;

    public DocumentStateMachine(PositionCodec codec, Clock clock) {
        this.codec = codec;
        this.clock = clock;
    }

    public SharedDocument apply(SharedDocument document, Operation operation) {
        switch (operation.getType()) {
            case INSERT:
                insert(document, operation);
                break;
            case DELETE:
                delete(document, operation);
                break;
            default:
                break;
        }
        document.advanceVersion(clock.millis());
        log.debug("Applied {} {} at {} to document {}, now version {}",
                operation.getType(), operation.getId(), operation.getPosition(), document.getId(), document.getVersion());
        return document;
    }

    private void insert(SharedDocument document, Operation operation) {
        int lineIndex = operation.getPosition().getLine();
        if (lineIndex - document.lineCount() >= LARGE_LINE_GROWTH) {
            log.warn("Insert {} at {} grows document {} from {} to {} lines",
                    operation.getId(), operation.getPosition(), document.getId(), document.lineCount(), lineIndex + 1);
        }
        while (document.lineCount() <= lineIndex) {
            document.insertLine(document.lineCount(), "");
        }

        String line = document.line(lineIndex);
        int column = clamp(operation.getPosition().getColumn(), line.length());
        String spliced = line.substring(0, column) + operation.contentOrEmpty() + line.substring(column);

        if (spliced.indexOf('\n') < 0) {
            document.setLine(lineIndex, spliced);
            checkBound(document, lineIndex, spliced);
            return;
        }
        String[] parts = spliced.split("\n", -1);
        document.setLine(lineIndex, parts[0]);
        checkBound(document, lineIndex, parts[0]);
        for (int i = 1; i < parts.length; i++) {
            document.insertLine(lineIndex + i, parts[i]);
            checkBound(document, lineIndex + i, parts[i]);
        }
    }

    private void delete(SharedDocument document, Operation operation) {
        int lineIndex = operation.getPosition().getLine();
        if (lineIndex >= document.lineCount()) {
            return;
        }

        String line = document.line(lineIndex);
        int column = operation.getPosition().getColumn();
        if (column > 0) {
            // only the part of [column - length, column) that lies inside the line is removed
            int from = Math.max(0, column - operation.lengthOrZero());
            if (from >= line.length()) {
                return;
            }
            int to = Math.min(column, line.length());
            document.setLine(lineIndex, line.substring(0, from) + line.substring(to));
        } else if (lineIndex > 0) {
            // column 0 removes the line break before this line
            String merged = document.line(lineIndex - 1) + line;
            document.setLine(lineIndex - 1, merged);
            document.removeLine(lineIndex);
            checkBound(document, lineIndex - 1, merged);
        }
    }

    private void checkBound(SharedDocument document, int lineIndex, String line) {
        if (line.length() >= codec.columnsPerLine()) {
            log.warn("Line {} of document {} has {} characters, positions past column {} no longer transform correctly",
                    lineIndex, document.getId(), line.length(), codec.columnsPerLine() - 1);
        }
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }
}
