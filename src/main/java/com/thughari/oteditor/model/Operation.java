package com.thughari.oteditor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.thughari.oteditor.message.MessageHandler;
import com.thughari.oteditor.message.MessagePayload;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * A single edit issued by one replica. Instances are immutable; the transform produces adjusted
 * copies that keep the original {@code id}.
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Operation implements MessagePayload {

    String id;
    OperationType type;
    Position position;
    String content;
    Integer length;
    String userId;
    Long timestamp;
    Long version;

    public static Operation retain(Operation source) {
        return source.toBuilder().type(OperationType.RETAIN).length(0).build();
    }

    /** Declared length, 0 when the field was absent on the wire. */
    public int lengthOrZero() {
        return length == null ? 0 : length;
    }

    public String contentOrEmpty() {
        return content == null ? "" : content;
    }

    /** Number of characters the operation spans: inserted text for inserts, length for deletes. */
    public int width() {
        if (type == OperationType.INSERT) {
            return contentOrEmpty().length();
        }
        return lengthOrZero();
    }

    @Override
    public boolean wellFormed() {
        return id != null && !id.isBlank()
                && type != null
                && position != null && position.getLine() >= 0 && position.getColumn() >= 0
                && userId != null
                && timestamp != null
                && version != null
                && (length == null || length >= 0)
                && (type != OperationType.INSERT || content != null);
    }

    @Override
    public void dispatch(MessageHandler handler) {
        handler.onDocumentChange(this);
    }
}
