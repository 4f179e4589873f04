package resqpack.core.packaging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.junit.jupiter.api.Test;

class TransactionScopeTest {
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    @Test
    void rollsBackInReverseOrderWhenNotCommitted() {
        List<String> undone = new ArrayList<>();

        try (TransactionScope tx = new TransactionScope(lock.writeLock(), "test")) {
            tx.onRollback(() -> undone.add("first"));
            tx.onRollback(() -> undone.add("second"));
            assertThat(lock.isWriteLockedByCurrentThread()).isTrue();
        }

        assertThat(undone).containsExactly("second", "first");
        assertThat(lock.isWriteLocked()).isFalse();
    }

    @Test
    void commitDropsUndoSteps() {
        List<String> undone = new ArrayList<>();

        try (TransactionScope tx = new TransactionScope(lock.writeLock(), "test")) {
            tx.onRollback(() -> undone.add("step"));
            tx.commit();
            assertThat(tx.isCommitted()).isTrue();
        }

        assertThat(undone).isEmpty();
        assertThat(lock.isWriteLocked()).isFalse();
    }

    @Test
    void failingUndoStepDoesNotStopTheOthers() {
        List<String> undone = new ArrayList<>();
        TransactionScope tx = new TransactionScope(lock.writeLock(), "test");
        tx.onRollback(() -> undone.add("first"));
        tx.onRollback(() -> {
            throw new IllegalStateException("undo failed");
        });
        tx.onRollback(() -> {
            throw new IllegalArgumentException("also failed");
        });

        assertThatThrownBy(tx::close)
                .isInstanceOf(IllegalArgumentException.class)
                .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
        assertThat(undone).containsExactly("first");
        assertThat(lock.isWriteLocked()).isFalse();
    }

    @Test
    void finishedScopeRejectsNewSteps() {
        TransactionScope tx = new TransactionScope(lock.writeLock(), "test");
        tx.commit();

        assertThatThrownBy(() -> tx.onRollback(() -> { }))
                .isInstanceOf(IllegalStateException.class);

        tx.close();
        tx.close();
        assertThat(lock.isWriteLocked()).isFalse();
        assertThatThrownBy(tx::commit).isInstanceOf(IllegalStateException.class);
    }
}
