package com.perpclear.clearing.tx;

import com.perpclear.core.exception.VenueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Undo log for one clearing operation.
 *
 * State owners register a compensating action the first time they are touched; ledger
 * and insurance mutations register one per call. Rollback replays them in reverse order.
 * Side effects that must only happen once the operation sticks (collaborator
 * notifications, journal writes) are queued with {@link #afterCommit(Runnable)}.
 */
public class EngineTransaction {

    private static final Logger log = LoggerFactory.getLogger(EngineTransaction.class);

    @FunctionalInterface
    public interface Undo {
        void undo() throws VenueException;
    }

    private final String operation;
    private final Deque<Undo> undoLog = new ArrayDeque<>();
    private final List<Runnable> commitHooks = new ArrayList<>();
    private final Set<Object> touched = new HashSet<>();
    private boolean finished;

    public EngineTransaction(String operation) {
        this.operation = operation;
    }

    /**
     * True the first time {@code key} is seen in this transaction.
     */
    public boolean firstTouch(Object key) {
        return touched.add(key);
    }

    public void onRollback(Undo undo) {
        requireOpen();
        undoLog.push(undo);
    }

    public void afterCommit(Runnable hook) {
        requireOpen();
        commitHooks.add(hook);
    }

    public void commit() {
        requireOpen();
        finished = true;
        undoLog.clear();
        for (Runnable hook : commitHooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                log.warn("{}: post-commit hook failed", operation, e);
            }
        }
    }

    /**
     * Undo every registered mutation, newest first. A failing compensation is logged and the
     * remaining ones still run.
     */
    public void rollback() {
        requireOpen();
        finished = true;
        int failures = 0;
        while (!undoLog.isEmpty()) {
            Undo undo = undoLog.pop();
            try {
                undo.undo();
            } catch (VenueException | RuntimeException e) {
                failures++;
                log.error("{}: compensation failed during rollback", operation, e);
            }
        }
        commitHooks.clear();
        if (failures > 0) {
            log.error("{}: rollback finished with {} failed compensations", operation, failures);
        } else {
            log.debug("{}: rolled back", operation);
        }
    }

    public String getOperation() {
        return operation;
    }

    private void requireOpen() {
        if (finished) {
            throw new IllegalStateException("Transaction " + operation + " already finished");
        }
    }
}
