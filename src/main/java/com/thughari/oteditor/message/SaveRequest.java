package com.thughari.oteditor.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Asks the server to persist the hosted document. {@code title} is optional. */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class SaveRequest implements MessagePayload {
    String title;

    @Override
    public void dispatch(MessageHandler handler) {
        handler.onFileSave(this);
    }
}
