package com.thughari.oteditor.message;

/** Wire names of the envelope {@code type} field. */
public final class MessageTypes {
    public static final String USER_JOIN = "user_join";
    public static final String USER_LEAVE = "user_leave";
    public static final String DOCUMENT_CHANGE = "document_change";
    public static final String CURSOR_CHANGE = "cursor_change";
    public static final String SELECTION_CHANGE = "selection_change";
    public static final String VERSION_SYNC = "version_sync";
    public static final String OPERATION_ACK = "operation_ack";
    public static final String FILE_SAVE = "file_save";
    public static final String LANGUAGE_CHANGE = "language_change";
    public static final String ERROR = "error";

    private MessageTypes() {
    }
}
