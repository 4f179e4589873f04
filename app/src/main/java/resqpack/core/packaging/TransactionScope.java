package resqpack.core.packaging;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write scope over one package. Holds the package write lock from creation to
 * {@link #close()} and undoes every registered step unless {@link #commit()}
 * was called first:
 *
 * <pre>
 * try (TransactionScope tx = pkg.beginTransaction("add grid")) {
 *     catalog.register(...);        tx.onRollback(() -> catalog.unregister(oid));
 *     metadata.put(doc);            tx.onRollback(() -> metadata.remove(oid));
 *     tx.commit();
 * }
 * </pre>
 *
 * Undo steps run in reverse registration order.
 */
public final class TransactionScope implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TransactionScope.class);

    private final Lock lock;
    private final String description;
    private final Deque<Runnable> undo = new ArrayDeque<>();
    private boolean committed;
    private boolean closed;

    TransactionScope(Lock lock, String description) {
        this.lock = lock;
        this.description = description;
        lock.lock();
    }

    public void onRollback(Runnable action) {
        if (closed || committed) {
            throw new IllegalStateException("Transaction " + description + " is already finished");
        }
        undo.push(action);
    }

    public void commit() {
        if (closed) {
            throw new IllegalStateException("Transaction " + description + " is already closed");
        }
        committed = true;
        undo.clear();
    }

    public boolean isCommitted() {
        return committed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (!committed && !undo.isEmpty()) {
                log.debug("Rolling back {} ({} step(s))", description, undo.size());
                RuntimeException failure = null;
                while (!undo.isEmpty()) {
                    try {
                        undo.pop().run();
                    } catch (RuntimeException e) {
                        if (failure == null) {
                            failure = e;
                        } else {
                            failure.addSuppressed(e);
                        }
                    }
                }
                if (failure != null) {
                    throw failure;
                }
            }
        } finally {
            lock.unlock();
        }
    }
}
