package com.thughari.oteditor.message;

/**
 * Body of a {@link CollabMessage}. The concrete class is chosen by the envelope's {@code type}.
 */
public interface MessagePayload {

    /** Whether every field the receiver relies on is present. */
    default boolean wellFormed() {
        return true;
    }

    void dispatch(MessageHandler handler);
}
