package com.thughari.oteditor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.thughari.oteditor.message.MessageHandler;
import com.thughari.oteditor.message.MessagePayload;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Authoritative full-state catch-up: a version number and the complete line list at that version.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class VersionSnapshot implements MessagePayload {

    long version;
    List<String> content;

    @Override
    public boolean wellFormed() {
        return content != null && version >= 0;
    }

    @Override
    public void dispatch(MessageHandler handler) {
        handler.onVersionSync(this);
    }
}
