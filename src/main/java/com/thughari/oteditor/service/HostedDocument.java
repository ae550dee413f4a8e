package com.thughari.oteditor.service;

import com.thughari.oteditor.document.DocumentStateMachine;
import com.thughari.oteditor.model.Operation;
import com.thughari.oteditor.model.SharedDocument;
import com.thughari.oteditor.model.VersionSnapshot;
import com.thughari.oteditor.ot.OperationalTransform;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Function;

/**
 * The server's authoritative copy of one document plus a bounded history of what it applied.
 * All access is serialized on the instance.
 */
@Slf4j
public class HostedDocument {

    private final SharedDocument document;
    private final DocumentStateMachine stateMachine;
    private final OperationalTransform transform;
    private final int historyLimit;
    private final Deque<Applied> history = new ArrayDeque<>();

    private static final class Applied {
        final Operation operation;
        final long baseVersion;

        Applied(Operation operation, long baseVersion) {
            this.operation = operation;
            this.baseVersion = baseVersion;
        }
    }

    public HostedDocument(SharedDocument document, DocumentStateMachine stateMachine,
                          OperationalTransform transform, int historyLimit) {
        this.document = document;
        this.stateMachine = stateMachine;
        this.transform = transform;
        this.historyLimit = historyLimit;
    }

    public String getId() {
        return document.getId();
    }

    /**
     * Transforms {@code incoming} against every operation another user got applied at or after the
     * version it was generated against, then applies it.
     *
     * @return the version of the hosted document after the apply
     */
    public synchronized long apply(Operation incoming) {
        Operation transformed = incoming;
        for (Applied applied : history) {
            if (applied.baseVersion >= incoming.getVersion()
                    && !applied.operation.getUserId().equals(incoming.getUserId())) {
                transformed = transform.transform(applied.operation, transformed).right;
            }
        }
        long baseVersion = document.getVersion();
        stateMachine.apply(document, transformed);
        history.addLast(new Applied(transformed, baseVersion));
        while (history.size() > historyLimit) {
            history.removeFirst();
        }
        if (transformed != incoming) {
            log.debug("Operation {} on document {} transformed {} -> {}",
                    incoming.getId(), document.getId(), incoming.getPosition(), transformed.getPosition());
        }
        return document.getVersion();
    }

    public synchronized VersionSnapshot snapshot() {
        return document.snapshot();
    }

    public synchronized void changeLanguage(String language) {
        document.setLanguage(language);
    }

    public synchronized void rename(String title) {
        document.setTitle(title);
    }

    public synchronized void join(String userId) {
        document.addCollaborator(userId);
    }

    public synchronized void leave(String userId) {
        document.removeCollaborator(userId);
    }

    /** Runs {@code action} while holding the document lock, for persistence. */
    public synchronized <T> T withDocument(Function<SharedDocument, T> action) {
        return action.apply(document);
    }

    public synchronized int historySize() {
        return history.size();
    }
}
