package com.thughari.oteditor.reconcile;

import com.thughari.oteditor.model.Operation;
import com.thughari.oteditor.ot.OperationalTransform;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Rewrites an incoming remote operation so that it applies on top of the local edits the remote
 * author had not seen.
 */
@Slf4j
public class Reconciler {

    private final OperationalTransform transform;

    public Reconciler(OperationalTransform transform) {
        this.transform = transform;
    }

    public Operation reconcile(PendingOperationQueue queue, Operation remote) {
        return reconcile(queue.pending(), remote);
    }

    /**
     * Transforms {@code remote} against each of {@code pending} (expected oldest first) whose
     * timestamp precedes it. Only the remote side of each pairwise result is carried forward;
     * the pending operations are left as they are.
     */
    public Operation reconcile(List<Operation> pending, Operation remote) {
        Operation transformed = remote;
        for (Operation local : pending) {
            if (local.getTimestamp() < remote.getTimestamp()) {
                transformed = transform.transform(local, transformed).right;
            }
        }
        if (transformed != remote) {
            log.debug("Reconciled remote operation {}: {} -> {}", remote.getId(), remote.getPosition(), transformed.getPosition());
        }
        return transformed;
    }
}
