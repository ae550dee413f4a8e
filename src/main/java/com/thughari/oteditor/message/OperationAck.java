package com.thughari.oteditor.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Server confirmation that an operation was applied to the hosted document at {@code version}. */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class OperationAck implements MessagePayload {
    String operationId;
    long version;

    @Override
    public boolean wellFormed() {
        return operationId != null;
    }

    @Override
    public void dispatch(MessageHandler handler) {
        handler.onOperationAck(this);
    }
}
