package com.thughari.oteditor.websocket;

import com.thughari.oteditor.message.CollabMessage;
import com.thughari.oteditor.message.MessageCodec;
import com.thughari.oteditor.service.DocumentHub;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Optional;

@Component
@Slf4j
public class EditorWebSocketHandler extends TextWebSocketHandler {

    private final MessageCodec messageCodec;
    private final DocumentHub documentHub;

    public EditorWebSocketHandler(MessageCodec messageCodec, DocumentHub documentHub) {
        this.messageCodec = messageCodec;
        this.documentHub = documentHub;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String docId = session.getUri() == null ? null : documentHub.getDocIdFromUri(session.getUri().getPath());
        if (docId == null) {
            log.warn("Connection attempt with invalid URI: {}", session.getUri());
            session.close(CloseStatus.BAD_DATA.withReason("Invalid document ID in URI"));
            return;
        }

        documentHub.registerSession(session, docId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        try {
            Optional<CollabMessage> decoded = messageCodec.decode(message.getPayload());
            if (decoded.isEmpty()) {
                if (session.isOpen()) {
                    documentHub.sendErrorMessage(session, "Invalid message format.");
                }
                return;
            }
            documentHub.handleMessage(session, decoded.get());
        } catch (IOException e) {
            log.error("IO Error handling text message from session {}: {}", session.getId(), message.getPayload(), e);
            if (session.isOpen()) {
                documentHub.sendErrorMessage(session, "Server error processing your request due to IO issue.");
            }
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        DocumentHub.SessionDetails details = documentHub.unregisterSession(session);

        log.info("Session {} (User: {}) disconnected. Reason: {}. Doc ID: {}",
                session.getId(),
                details.getUserId() != null ? details.getUserId() : "N/A",
                status,
                details.getDocId() != null ? details.getDocId() : "N/A");
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.error("Transport error for session {}: {}", session.getId(), exception.getMessage(), exception);
        super.handleTransportError(session, exception);
    }
}
