package com.thughari.oteditor.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ErrorNotice implements MessagePayload {
    String message;

    public static ErrorNotice of(String message) {
        return ErrorNotice.builder().message(message).build();
    }

    @Override
    public void dispatch(MessageHandler handler) {
        handler.onError(this);
    }
}
