package com.thughari.oteditor.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.thughari.oteditor.model.Position;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class CursorChange implements MessagePayload {
    String userId;
    Position cursor;

    @Override
    public boolean wellFormed() {
        return userId != null && cursor != null;
    }

    @Override
    public void dispatch(MessageHandler handler) {
        handler.onCursorChange(this);
    }
}
