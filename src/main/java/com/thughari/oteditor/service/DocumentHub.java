package com.thughari.oteditor.service;

import com.thughari.oteditor.config.CollabProperties;
import com.thughari.oteditor.document.DocumentStateMachine;
import com.thughari.oteditor.message.CollabMessage;
import com.thughari.oteditor.message.Collaborator;
import com.thughari.oteditor.message.CursorChange;
import com.thughari.oteditor.message.ErrorNotice;
import com.thughari.oteditor.message.LanguageChange;
import com.thughari.oteditor.message.MessageCodec;
import com.thughari.oteditor.message.MessageHandler;
import com.thughari.oteditor.message.MessagePayload;
import com.thughari.oteditor.message.OperationAck;
import com.thughari.oteditor.message.SaveRequest;
import com.thughari.oteditor.message.SelectionChange;
import com.thughari.oteditor.message.UserLeave;
import com.thughari.oteditor.model.DocumentEntity;
import com.thughari.oteditor.model.Operation;
import com.thughari.oteditor.model.SharedDocument;
import com.thughari.oteditor.model.VersionSnapshot;
import com.thughari.oteditor.ot.OperationalTransform;
import com.thughari.oteditor.ot.PositionCodec;
import com.thughari.oteditor.repo.DocumentRepository;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Relays collaboration traffic between the sessions of each document and keeps the authoritative
 * {@link HostedDocument} that acknowledgments and version syncs are taken from.
 */
@Service
@Slf4j
public class DocumentHub {

    static final String SERVER_ID = "server";
    private static final String PATH_PREFIX = "/collaborate/";

    private final MessageCodec messageCodec;
    private final DocumentRepository documentRepository;
    private final PositionCodec positionCodec;
    private final CollabProperties properties;
    private final Clock clock;

    private final Map<String, Set<WebSocketSession>> docSessions = new ConcurrentHashMap<>();
    private final Map<WebSocketSession, String> sessionToDocId = new ConcurrentHashMap<>();
    private final Map<WebSocketSession, String> sessionToUserId = new ConcurrentHashMap<>();
    private final Map<String, HostedDocument> hostedDocuments = new ConcurrentHashMap<>();

    public DocumentHub(MessageCodec messageCodec, DocumentRepository documentRepository,
                       PositionCodec positionCodec, CollabProperties properties, Clock clock) {
        this.messageCodec = messageCodec;
        this.documentRepository = documentRepository;
        this.positionCodec = positionCodec;
        this.properties = properties;
        this.clock = clock;
    }

    @Getter
    public static class SessionDetails {
        private final String docId;
        private final String userId;

        public SessionDetails(String docId, String userId) {
            this.docId = docId;
            this.userId = userId;
        }
    }

    public String getDocIdFromUri(String path) {
        if (path == null || !path.contains(PATH_PREFIX)) {
            return null;
        }
        int lastSlash = path.lastIndexOf("/");
        if (lastSlash == path.length() - 1) {
            log.warn("Document ID is missing from URI path: {}", path);
            return null;
        }
        return path.substring(lastSlash + 1);
    }

    public void registerSession(WebSocketSession session, String docId) {
        sessionToDocId.put(session, docId);
        docSessions.computeIfAbsent(docId, k -> ConcurrentHashMap.newKeySet()).add(session);
        hostedDocuments.computeIfAbsent(docId, this::openDocument);
        log.info("Session {} registered for document {}. Awaiting '{}' message.", session.getId(), docId, "user_join");
    }

    public SessionDetails unregisterSession(WebSocketSession session) {
        String docId = sessionToDocId.remove(session);
        String userId = sessionToUserId.remove(session);

        if (docId != null) {
            HostedDocument hosted = hostedDocuments.get(docId);
            if (hosted != null && userId != null) {
                hosted.leave(userId);
            }
            Set<WebSocketSession> sessionsInDoc = docSessions.get(docId);
            if (sessionsInDoc != null) {
                sessionsInDoc.remove(session);
                if (sessionsInDoc.isEmpty()) {
                    docSessions.remove(docId);
                    HostedDocument closed = hostedDocuments.remove(docId);
                    if (closed != null) {
                        persist(closed);
                    }
                    log.info("All sessions closed for document {}. It is now inactive.", docId);
                } else if (userId != null) {
                    try {
                        broadcastMessageToAll(docId, CollabMessage.of(
                                UserLeave.builder().userId(userId).build(), userId, clock.millis()));
                    } catch (IOException e) {
                        log.error("Error broadcasting departure of {} from doc {}: {}", userId, docId, e.getMessage());
                    }
                }
            }
        }
        return new SessionDetails(docId, userId);
    }

    public String getDocIdForSession(WebSocketSession session) {
        return sessionToDocId.get(session);
    }

    public String getUserIdForSession(WebSocketSession session) {
        return sessionToUserId.get(session);
    }

    public HostedDocument getHostedDocument(String docId) {
        return hostedDocuments.get(docId);
    }

    public List<String> getCurrentCollaborators(String docId) {
        Set<WebSocketSession> sessions = docSessions.get(docId);
        if (sessions == null) {
            return new ArrayList<>();
        }
        return sessions.stream()
                .map(sessionToUserId::get)
                .filter(name -> name != null && !name.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }

    public void handleMessage(WebSocketSession session, CollabMessage message) throws IOException {
        String docId = sessionToDocId.get(session);
        if (docId == null) {
            log.warn("Message received for session {} which has no document ID associated.", session.getId());
            sendErrorMessage(session, "Session not properly initialized with a document ID.");
            return;
        }
        HostedDocument hosted = hostedDocuments.get(docId);
        if (hosted == null) {
            sendErrorMessage(session, "Document session not found.");
            return;
        }
        SessionMessageHandler handler = new SessionMessageHandler(session, docId, hosted, message);
        message.dispatch(handler);
        if (handler.failure != null) {
            throw handler.failure;
        }
    }

    /** Sends every active document's current snapshot to all of its sessions. */
    public void broadcastSnapshots() {
        hostedDocuments.forEach((docId, hosted) -> {
            try {
                broadcastMessageToAll(docId, CollabMessage.of(hosted.snapshot(), SERVER_ID, clock.millis()));
            } catch (IOException e) {
                log.error("Error broadcasting version sync for doc {}: {}", docId, e.getMessage());
            }
        });
    }

    public void persist(HostedDocument hosted) {
        DocumentEntity entity = hosted.withDocument(DocumentEntity::from);
        documentRepository.save(entity);
        log.info("Document {} saved at version {}", entity.getId(), entity.getVersion());
    }

    public void sendMessageToSession(WebSocketSession session, CollabMessage message) throws IOException {
        if (session.isOpen()) {
            String messageString = messageCodec.encode(message);
            synchronized (session) {
                session.sendMessage(new TextMessage(messageString));
            }
        } else {
            log.warn("Attempted to send message to closed session {}: {}", session.getId(), message);
        }
    }

    public void sendErrorMessage(WebSocketSession session, String errorMessage) throws IOException {
        sendMessageToSession(session, CollabMessage.of(ErrorNotice.of(errorMessage), SERVER_ID, clock.millis()));
    }

    public void broadcastMessageToAll(String docId, CollabMessage message) throws IOException {
        broadcast(docId, null, message);
    }

    public void broadcastMessageToOthers(String docId, WebSocketSession sender, CollabMessage message) throws IOException {
        broadcast(docId, sender, message);
    }

    private void broadcast(String docId, WebSocketSession excluded, CollabMessage message) throws IOException {
        Set<WebSocketSession> sessions = docSessions.get(docId);
        if (sessions != null) {
            String messageString = messageCodec.encode(message);
            for (WebSocketSession s : sessions) {
                if (s.isOpen() && !s.equals(excluded)) {
                    synchronized (s) {
                        s.sendMessage(new TextMessage(messageString));
                    }
                }
            }
        }
    }

    private HostedDocument openDocument(String docId) {
        SharedDocument document = documentRepository.findById(docId)
                .map(DocumentEntity::toSharedDocument)
                .orElseGet(() -> {
                    log.info("Document {} not found, creating new.", docId);
                    return documentRepository.save(new DocumentEntity(docId)).toSharedDocument();
                });
        return new HostedDocument(document,
                new DocumentStateMachine(positionCodec, clock),
                new OperationalTransform(positionCodec),
                properties.getHistoryLimit());
    }

    /**
     * Handles one inbound message for one session. I/O failures are kept and rethrown by
     * {@link #handleMessage} since the callbacks cannot declare them.
     */
    private class SessionMessageHandler implements MessageHandler {
        private final WebSocketSession session;
        private final String docId;
        private final HostedDocument hosted;
        private final CollabMessage message;
        private IOException failure;

        SessionMessageHandler(WebSocketSession session, String docId, HostedDocument hosted, CollabMessage message) {
            this.session = session;
            this.docId = docId;
            this.hosted = hosted;
            this.message = message;
        }

        @Override
        public void onUserJoin(Collaborator collaborator) {
            String userId = collaborator.getId();
            run(() -> {
                sessionToUserId.put(session, userId);
                hosted.join(userId);
                log.info("User '{}' (session {}) joined document '{}'", userId, session.getId(), docId);
                sendMessageToSession(session, CollabMessage.of(hosted.snapshot(), SERVER_ID, clock.millis()));
                broadcastMessageToOthers(docId, session, CollabMessage.of(collaborator, userId, message.getTimestamp()));
            });
        }

        @Override
        public void onDocumentChange(Operation operation) {
            run(() -> {
                String userId = requireJoined("edit");
                if (userId == null) {
                    return;
                }
                if (!userId.equals(operation.getUserId())) {
                    log.warn("Operation {} claims user {} but session {} belongs to {}",
                            operation.getId(), operation.getUserId(), session.getId(), userId);
                    sendErrorMessage(session, "Operation user does not match the joined user.");
                    return;
                }
                long version = hosted.apply(operation);
                sendMessageToSession(session, CollabMessage.of(
                        OperationAck.builder().operationId(operation.getId()).version(version).build(),
                        SERVER_ID, clock.millis()));
                broadcastMessageToOthers(docId, session, message);
                log.debug("Document {} changed by '{}' to version {}. Broadcasting.", docId, userId, version);
            });
        }

        @Override
        public void onCursorChange(CursorChange change) {
            relayFromJoined("cursor");
        }

        @Override
        public void onSelectionChange(SelectionChange change) {
            relayFromJoined("selection");
        }

        @Override
        public void onLanguageChange(LanguageChange change) {
            run(() -> {
                if (requireJoined("change language") == null) {
                    return;
                }
                hosted.changeLanguage(change.getLanguage());
                broadcastMessageToOthers(docId, session, message);
            });
        }

        @Override
        public void onFileSave(SaveRequest request) {
            run(() -> {
                if (requireJoined("save") == null) {
                    return;
                }
                if (request.getTitle() != null && !request.getTitle().isBlank()) {
                    hosted.rename(request.getTitle());
                }
                persist(hosted);
            });
        }

        @Override
        public void onUserLeave(UserLeave leave) {
            run(() -> {
                String userId = sessionToUserId.remove(session);
                if (userId != null) {
                    hosted.leave(userId);
                    broadcastMessageToOthers(docId, session, CollabMessage.of(
                            UserLeave.builder().userId(userId).build(), userId, message.getTimestamp()));
                }
            });
        }

        @Override
        public void onVersionSync(VersionSnapshot snapshot) {
            ignore();
        }

        @Override
        public void onOperationAck(OperationAck ack) {
            ignore();
        }

        @Override
        public void onError(ErrorNotice error) {
            log.warn("Session {} reported an error on doc {}: {}", session.getId(), docId, error.getMessage());
        }

        private void relayFromJoined(String action) {
            run(() -> {
                if (requireJoined(action) != null) {
                    broadcastMessageToOthers(docId, session, message);
                }
            });
        }

        private String requireJoined(String action) throws IOException {
            String userId = sessionToUserId.get(session);
            if (userId == null) {
                log.warn("{} attempt from session {} without established user for doc {}", action, session.getId(), docId);
                sendErrorMessage(session, "Cannot " + action + ": user not properly joined. Please send 'user_join' message first.");
            }
            return userId;
        }

        private void ignore() {
            MessagePayload payload = message.getPayload();
            log.warn("Ignoring server-bound {} from session {} for doc {}",
                    payload.getClass().getSimpleName(), session.getId(), docId);
        }

        private void run(IoAction action) {
            try {
                action.run();
            } catch (IOException e) {
                failure = e;
            }
        }
    }

    @FunctionalInterface
    private interface IoAction {
        void run() throws IOException;
    }
}
