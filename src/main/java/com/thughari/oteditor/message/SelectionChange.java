package com.thughari.oteditor.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.thughari.oteditor.model.Selection;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class SelectionChange implements MessagePayload {
    String userId;
    Selection selection;

    @Override
    public boolean wellFormed() {
        return userId != null && selection != null && selection.getStart() != null && selection.getEnd() != null;
    }

    @Override
    public void dispatch(MessageHandler handler) {
        handler.onSelectionChange(this);
    }
}
