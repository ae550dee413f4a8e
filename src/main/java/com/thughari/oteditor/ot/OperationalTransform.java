package com.thughari.oteditor.ot;

import com.thughari.oteditor.model.Operation;
import com.thughari.oteditor.model.OperationType;

/**
 * Pairwise transform over concurrent text operations.
 * <p>
 * Given {@code a} and {@code b} generated against the same document version,
 * {@link #transform(Operation, Operation)} returns {@code (a', b')} where {@code a'} is {@code a}
 * rewritten to apply after {@code b} and {@code b'} is {@code b} rewritten to apply after {@code a}.
 * Only insert and delete take part; retain, cursor and selection pass through untouched.
 * <p>
 * A delete is positioned at its caret: it removes the {@code length} characters that end at
 * {@code position}, so its span is {@code [index - length, index)}.
 * <p>
 * The transform never fails. It returns new operation values and keeps every {@code id}.
 */
public final class OperationalTransform {

    private final PositionCodec codec;

    public OperationalTransform(PositionCodec codec) {
        this.codec = codec;
    }

    public TransformResult transform(Operation a, Operation b) {
        OperationType left = a.getType();
        OperationType right = b.getType();
        if (!left.editsText() || !right.editsText()) {
            return TransformResult.of(a, b);
        }
        if (left == OperationType.INSERT && right == OperationType.INSERT) {
            return transformInsertInsert(a, b);
        } else if (left == OperationType.INSERT && right == OperationType.DELETE) {
            return transformInsertDelete(a, b);
        } else if (left == OperationType.DELETE && right == OperationType.INSERT) {
            return transformInsertDelete(b, a).swap();
        }
        return transformDeleteDelete(a, b);
    }

    private TransformResult transformInsertInsert(Operation a, Operation b) {
        long pos1 = codec.toIndex(a.getPosition());
        long pos2 = codec.toIndex(b.getPosition());

        if (pos1 < pos2 || (pos1 == pos2 && sortsFirst(a, b))) {
            return TransformResult.of(a, shift(b, a.width()));
        }
        return TransformResult.of(shift(a, b.width()), b);
    }

    private TransformResult transformInsertDelete(Operation insert, Operation delete) {
        long insertPos = codec.toIndex(insert.getPosition());
        long deleteEnd = codec.toIndex(delete.getPosition());
        int deleteLength = delete.lengthOrZero();
        long deleteStart = deleteEnd - deleteLength;

        if (insertPos <= deleteStart) {
            return TransformResult.of(insert, shift(delete, insert.width()));
        } else if (insertPos > deleteEnd) {
            return TransformResult.of(shift(insert, -deleteLength), delete);
        }
        // inside the deleted span: keep the text, move it to where the span collapses
        return TransformResult.of(insert.withPosition(codec.toPosition(Math.max(0, deleteStart))), delete);
    }

    private TransformResult transformDeleteDelete(Operation a, Operation b) {
        long end1 = codec.toIndex(a.getPosition());
        long end2 = codec.toIndex(b.getPosition());
        int len1 = a.lengthOrZero();
        int len2 = b.lengthOrZero();
        long start1 = end1 - len1;
        long start2 = end2 - len2;

        if (end1 <= start2) {
            return TransformResult.of(a, shift(b, -len1));
        } else if (end2 <= start1) {
            return TransformResult.of(shift(a, -len2), b);
        }

        long newStart = Math.max(0, Math.min(start1, start2));
        long newEnd = Math.max(end1, end2);
        Operation merged = a.toBuilder()
                .position(codec.toPosition(newEnd))
                .length((int) (newEnd - newStart))
                .build();
        return TransformResult.of(merged, Operation.retain(b));
    }

    private Operation shift(Operation operation, long offset) {
        if (offset == 0) {
            return operation;
        }
        return operation.withPosition(codec.adjust(operation.getPosition(), offset));
    }

    /** Total order for inserts at the same index: user id, then operation id. */
    private static boolean sortsFirst(Operation a, Operation b) {
        int byUser = compareNullable(a.getUserId(), b.getUserId());
        if (byUser != 0) {
            return byUser < 0;
        }
        return compareNullable(a.getId(), b.getId()) < 0;
    }

    private static int compareNullable(String x, String y) {
        if (x == null || y == null) {
            return x == null ? (y == null ? 0 : -1) : 1;
        }
        return x.compareTo(y);
    }
}
