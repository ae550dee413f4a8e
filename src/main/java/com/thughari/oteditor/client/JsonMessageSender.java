package com.thughari.oteditor.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.thughari.oteditor.message.CollabMessage;
import com.thughari.oteditor.message.MessageCodec;

import java.util.function.Consumer;

/**
 * Adapts a text-frame transport (a browser-style socket, a test buffer) to {@link MessageSender}.
 */
public class JsonMessageSender implements MessageSender {

    private final MessageCodec codec;
    private final Consumer<String> frames;

    public JsonMessageSender(MessageCodec codec, Consumer<String> frames) {
        this.codec = codec;
        this.frames = frames;
    }

    @Override
    public void send(CollabMessage message) {
        try {
            frames.accept(codec.encode(message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + message.getPayload().getClass().getSimpleName(), e);
        }
    }
}
