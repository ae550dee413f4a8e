package com.thughari.oteditor.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.thughari.oteditor.model.Operation;
import com.thughari.oteditor.model.VersionSnapshot;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope exchanged over the socket: {@code {type, payload, userId, timestamp}}. The
 * {@code type} property is written and read by Jackson from the payload class.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CollabMessage {

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXTERNAL_PROPERTY, property = "type")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = Collaborator.class, name = MessageTypes.USER_JOIN),
            @JsonSubTypes.Type(value = UserLeave.class, name = MessageTypes.USER_LEAVE),
            @JsonSubTypes.Type(value = Operation.class, name = MessageTypes.DOCUMENT_CHANGE),
            @JsonSubTypes.Type(value = CursorChange.class, name = MessageTypes.CURSOR_CHANGE),
            @JsonSubTypes.Type(value = SelectionChange.class, name = MessageTypes.SELECTION_CHANGE),
            @JsonSubTypes.Type(value = VersionSnapshot.class, name = MessageTypes.VERSION_SYNC),
            @JsonSubTypes.Type(value = OperationAck.class, name = MessageTypes.OPERATION_ACK),
            @JsonSubTypes.Type(value = SaveRequest.class, name = MessageTypes.FILE_SAVE),
            @JsonSubTypes.Type(value = LanguageChange.class, name = MessageTypes.LANGUAGE_CHANGE),
            @JsonSubTypes.Type(value = ErrorNotice.class, name = MessageTypes.ERROR)
    })
    private MessagePayload payload;
    private String userId;
    private long timestamp;

    public static CollabMessage of(MessagePayload payload, String userId, long timestamp) {
        return new CollabMessage(payload, userId, timestamp);
    }

    public void dispatch(MessageHandler handler) {
        payload.dispatch(handler);
    }
}
