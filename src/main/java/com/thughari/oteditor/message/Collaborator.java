package com.thughari.oteditor.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** A user announcing itself on a document. Presence fields beyond id and name are ignored. */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Collaborator implements MessagePayload {
    String id;
    String name;

    @Override
    public boolean wellFormed() {
        return id != null && !id.isBlank();
    }

    @Override
    public void dispatch(MessageHandler handler) {
        handler.onUserJoin(this);
    }
}
