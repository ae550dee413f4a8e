package com.thughari.oteditor.message;

import com.thughari.oteditor.model.Operation;
import com.thughari.oteditor.model.VersionSnapshot;

/**
 * One callback per message kind. Implementations must handle every kind, so adding a payload
 * type breaks the build until both the client and the server deal with it.
 */
public interface MessageHandler {

    void onDocumentChange(Operation operation);

    void onVersionSync(VersionSnapshot snapshot);

    void onOperationAck(OperationAck ack);

    void onUserJoin(Collaborator collaborator);

    void onUserLeave(UserLeave leave);

    void onCursorChange(CursorChange change);

    void onSelectionChange(SelectionChange change);

    void onLanguageChange(LanguageChange change);

    void onFileSave(SaveRequest request);

    void onError(ErrorNotice error);
}
