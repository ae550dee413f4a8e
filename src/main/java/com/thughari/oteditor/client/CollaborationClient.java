package com.thughari.oteditor.client;

import com.thughari.oteditor.document.DocumentStateMachine;
import com.thughari.oteditor.message.CollabMessage;
import com.thughari.oteditor.message.Collaborator;
import com.thughari.oteditor.message.CursorChange;
import com.thughari.oteditor.message.ErrorNotice;
import com.thughari.oteditor.message.LanguageChange;
import com.thughari.oteditor.message.MessageHandler;
import com.thughari.oteditor.message.MessagePayload;
import com.thughari.oteditor.message.OperationAck;
import com.thughari.oteditor.message.SaveRequest;
import com.thughari.oteditor.message.SelectionChange;
import com.thughari.oteditor.message.UserLeave;
import com.thughari.oteditor.model.Operation;
import com.thughari.oteditor.model.OperationType;
import com.thughari.oteditor.model.Position;
import com.thughari.oteditor.model.Selection;
import com.thughari.oteditor.model.SharedDocument;
import com.thughari.oteditor.model.VersionSnapshot;
import com.thughari.oteditor.ot.OperationalTransform;
import com.thughari.oteditor.ot.PositionCodec;
import com.thughari.oteditor.reconcile.PendingOperationQueue;
import com.thughari.oteditor.reconcile.Reconciler;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One user's replica of a shared document.
 * <p>
 * Local edits are applied immediately, queued as pending and broadcast. Remote operations are
 * reconciled against the pending queue before they are applied. A version sync newer than the
 * local version replaces the whole document.
 * <p>
 * Not thread-safe: every call is expected on the same event thread.
 */
@Slf4j
public class CollaborationClient implements MessageHandler {

    public static final Duration DEFAULT_GRACE_WINDOW = Duration.ofSeconds(5);

    private final String userId;
    private final SharedDocument document;
    private final PendingOperationQueue pendingQueue;
    private final DocumentStateMachine stateMachine;
    private final Reconciler reconciler;
    private final MessageSender sender;
    private final Clock clock;

    private final Map<String, Position> remoteCursors = new HashMap<>();
    private final Map<String, Selection> remoteSelections = new HashMap<>();
    private long lastTimestamp;

    public CollaborationClient(String userId, SharedDocument document, MessageSender sender) {
        this(userId, document, sender, new PositionCodec(), DEFAULT_GRACE_WINDOW, Clock.systemUTC());
    }

    public CollaborationClient(String userId, SharedDocument document, MessageSender sender,
                               PositionCodec codec, Duration graceWindow, Clock clock) {
        this.userId = userId;
        this.document = document;
        this.sender = sender;
        this.clock = clock;
        this.pendingQueue = new PendingOperationQueue(graceWindow);
        this.stateMachine = new DocumentStateMachine(codec, clock);
        this.reconciler = new Reconciler(new OperationalTransform(codec));
        document.addCollaborator(userId);
    }

    public String getUserId() {
        return userId;
    }

    public SharedDocument getDocument() {
        return document;
    }

    public PendingOperationQueue getPendingQueue() {
        return pendingQueue;
    }

    public Map<String, Position> getRemoteCursors() {
        return Collections.unmodifiableMap(remoteCursors);
    }

    public Map<String, Selection> getRemoteSelections() {
        return Collections.unmodifiableMap(remoteSelections);
    }

    public Operation applyLocalInsert(Position position, String content) {
        return applyLocalEdit(newOperation(OperationType.INSERT, position)
                .content(content)
                .build());
    }

    public Operation applyLocalDelete(Position position, int length) {
        return applyLocalEdit(newOperation(OperationType.DELETE, position)
                .content("")
                .length(length)
                .build());
    }

    private Operation applyLocalEdit(Operation operation) {
        stateMachine.apply(document, operation);
        pendingQueue.add(operation, clock.instant());
        send(operation);
        log.debug("User {} issued {} {} at {}", userId, operation.getType(), operation.getId(), operation.getPosition());
        return operation;
    }

    public SharedDocument receiveRemoteOperation(Operation operation) {
        if (!operation.wellFormed()) {
            log.warn("Dropping malformed remote operation {}", operation);
            return document;
        }
        expirePending();
        if (userId.equals(operation.getUserId()) && pendingQueue.contains(operation.getId())) {
            log.debug("Ignoring echo of own operation {}", operation.getId());
            return document;
        }
        Operation transformed = reconciler.reconcile(pendingQueue, operation);
        return stateMachine.apply(document, transformed);
    }

    public SharedDocument receiveVersionSync(VersionSnapshot snapshot) {
        if (snapshot.getVersion() <= document.getVersion()) {
            log.debug("Ignoring version sync {} for document {} at version {}",
                    snapshot.getVersion(), document.getId(), document.getVersion());
            return document;
        }
        log.info("Document {} caught up from version {} to {}", document.getId(), document.getVersion(), snapshot.getVersion());
        document.restore(snapshot, clock.millis());
        return document;
    }

    /** Drops pending operations whose grace window has run out. */
    public int expirePending() {
        int expired = pendingQueue.expire(clock.instant());
        if (expired > 0) {
            log.debug("Expired {} pending operations of user {}", expired, userId);
        }
        return expired;
    }

    public void moveCursor(Position cursor) {
        send(CursorChange.builder().userId(userId).cursor(cursor).build());
    }

    public void changeSelection(Selection selection) {
        send(SelectionChange.builder().userId(userId).selection(selection).build());
    }

    public void changeLanguage(String language) {
        document.setLanguage(language);
        send(LanguageChange.builder().language(language).build());
    }

    public void updateTitle(String title) {
        document.setTitle(title);
    }

    public void save() {
        send(SaveRequest.builder().title(document.getTitle()).build());
    }

    public void onMessage(CollabMessage message) {
        message.dispatch(this);
    }

    @Override
    public void onDocumentChange(Operation operation) {
        receiveRemoteOperation(operation);
    }

    @Override
    public void onVersionSync(VersionSnapshot snapshot) {
        receiveVersionSync(snapshot);
    }

    @Override
    public void onOperationAck(OperationAck ack) {
        pendingQueue.acknowledge(ack.getOperationId());
    }

    @Override
    public void onUserJoin(Collaborator collaborator) {
        if (document.addCollaborator(collaborator.getId())) {
            log.info("User {} joined document {}", collaborator.getId(), document.getId());
        }
    }

    @Override
    public void onUserLeave(UserLeave leave) {
        document.removeCollaborator(leave.getUserId());
        remoteCursors.remove(leave.getUserId());
        remoteSelections.remove(leave.getUserId());
        log.info("User {} left document {}", leave.getUserId(), document.getId());
    }

    @Override
    public void onCursorChange(CursorChange change) {
        if (!userId.equals(change.getUserId())) {
            remoteCursors.put(change.getUserId(), change.getCursor());
        }
    }

    @Override
    public void onSelectionChange(SelectionChange change) {
        if (!userId.equals(change.getUserId())) {
            remoteSelections.put(change.getUserId(), change.getSelection());
        }
    }

    @Override
    public void onLanguageChange(LanguageChange change) {
        document.setLanguage(change.getLanguage());
    }

    @Override
    public void onFileSave(SaveRequest request) {
        log.debug("Ignoring file_save addressed to the server");
    }

    @Override
    public void onError(ErrorNotice error) {
        log.warn("Server reported an error for document {}: {}", document.getId(), error.getMessage());
    }

    private Operation.OperationBuilder newOperation(OperationType type, Position position) {
        long timestamp = nextTimestamp();
        return Operation.builder()
                .id(userId + "_" + timestamp + "_" + UUID.randomUUID().toString().substring(0, 8))
                .type(type)
                .position(position)
                .userId(userId)
                .timestamp(timestamp)
                .version(document.getVersion());
    }

    /** Wall-clock millis, bumped when needed so that successive local timestamps strictly increase. */
    private long nextTimestamp() {
        lastTimestamp = Math.max(lastTimestamp + 1, clock.millis());
        return lastTimestamp;
    }

    private void send(MessagePayload payload) {
        sender.send(CollabMessage.of(payload, userId, clock.millis()));
    }
}
