package com.thughari.oteditor.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserLeave implements MessagePayload {
    String userId;

    @Override
    public boolean wellFormed() {
        return userId != null;
    }

    @Override
    public void dispatch(MessageHandler handler) {
        handler.onUserLeave(this);
    }
}
