package com.thughari.oteditor.client;

import com.thughari.oteditor.message.CollabMessage;

/** Outbound side of whatever transport carries a client's messages. */
@FunctionalInterface
public interface MessageSender {
    void send(CollabMessage message);
}
