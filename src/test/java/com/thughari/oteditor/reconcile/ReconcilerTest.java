package com.thughari.oteditor.reconcile;

import com.thughari.oteditor.model.Operation;
import com.thughari.oteditor.model.Position;
import com.thughari.oteditor.ot.OperationalTransform;
import com.thughari.oteditor.ot.PositionCodec;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.thughari.oteditor.TestOperations.delete;
import static com.thughari.oteditor.TestOperations.insert;
import static org.assertj.core.api.Assertions.assertThat;

class ReconcilerTest {

    private final Reconciler reconciler = new Reconciler(new OperationalTransform(new PositionCodec()));

    @Test
    void transformsAgainstOlderPendingOperation() {
        Operation local = insert("a", 0, 0, "ab", 10);
        Operation remote = insert("b", 0, 3, "Z", 20);

        Operation result = reconciler.reconcile(List.of(local), remote);

        assertThat(result.getPosition()).isEqualTo(Position.of(0, 5));
        assertThat(result.getId()).isEqualTo(remote.getId());
    }

    @Test
    void skipsPendingOperationsNewerThanTheRemoteOne() {
        Operation local = insert("a", 0, 0, "ab", 30);
        Operation remote = insert("b", 0, 3, "Z", 20);

        assertThat(reconciler.reconcile(List.of(local), remote)).isSameAs(remote);
    }

    @Test
    void carriesRemoteSideThroughEveryPendingOperationOldestFirst() {
        PendingOperationQueue queue = new PendingOperationQueue(Duration.ofSeconds(5));
        Operation typed = insert("a", 0, 0, "a", 10);
        Operation erased = delete("a", 0, 5, 2, 12);
        queue.add(erased, Instant.EPOCH);
        queue.add(typed, Instant.EPOCH);
        Operation remote = insert("b", 0, 8, "Z", 20);

        Operation result = reconciler.reconcile(queue, remote);

        assertThat(result.getPosition()).isEqualTo(Position.of(0, 7));
        assertThat(queue.pending()).containsExactly(typed, erased);
        assertThat(queue.pending().get(1).getPosition()).isEqualTo(Position.of(0, 5));
    }

    @Test
    void emptyQueueLeavesRemoteUntouched() {
        Operation remote = delete("b", 0, 4, 1, 20);

        assertThat(reconciler.reconcile(List.of(), remote)).isSameAs(remote);
    }
}
