package com.thughari.oteditor.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class LanguageChange implements MessagePayload {
    String language;

    @Override
    public boolean wellFormed() {
        return language != null && !language.isBlank();
    }

    @Override
    public void dispatch(MessageHandler handler) {
        handler.onLanguageChange(this);
    }
}
