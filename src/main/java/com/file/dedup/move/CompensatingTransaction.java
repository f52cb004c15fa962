package com.file.dedup.move;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Compensating transaction for filesystem steps.
 * Records compensation actions that are executed in reverse order
 * if any step fails or the transaction is not marked as successful.
 *
 * <p>Compensation is best-effort: a failing compensation is logged, attached as a suppressed
 * exception to the failure that triggered it, and the remaining compensations still run.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * try (CompensatingTransaction tx = new CompensatingTransaction()) {
 *     tx.execute("move a", () -&gt; mover.move(a, heldA), () -&gt; mover.move(heldA, a));
 *     tx.execute("move b", () -&gt; mover.move(b, heldB), () -&gt; mover.move(heldB, b));
 *     tx.markSuccess();
 * }
 * // If markSuccess() was not called, all compensations run in reverse order
 * </pre>
 */
public class CompensatingTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CompensatingTransaction.class);

    /**
     * A step or compensation that may fail with an I/O error.
     */
    @FunctionalInterface
    public interface Step {
        void run() throws IOException;
    }

    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;

    /**
     * Executes a step and registers its compensation.
     * If the step fails, all previously registered compensations are executed in
     * reverse order and the failure is rethrown with any compensation failures suppressed on it.
     *
     * @param description  human-readable description of the step
     * @param operation    the step to perform
     * @param compensation the action that reverses the step
     * @throws IOException if the step fails with an I/O error (after running compensations)
     */
    public void execute(String description, Step operation, Step compensation) throws IOException {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }

        try {
            log.debug("transaction.step description={}", description);
            operation.run();
            compensationStack.push(new CompensatingAction(description, compensation));
        } catch (IOException | RuntimeException e) {
            log.warn("transaction.stepFailed description={} error={}; running {} compensations",
                    description, e.getMessage(), compensationStack.size());
            runCompensations(e);
            throw e;
        }
    }

    /**
     * Marks the transaction as successful.
     * If called before close(), compensations will not be executed.
     */
    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Number of steps that completed and can still be compensated.
     */
    public int pendingCompensations() {
        return compensationStack.size();
    }

    @Override
    public void close() {
        if (!closed && !success && !compensationStack.isEmpty()) {
            log.warn("transaction.closedWithoutSuccess compensations={}", compensationStack.size());
            runCompensations(null);
        }
        closed = true;
    }

    private void runCompensations(Throwable failure) {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("transaction.compensate description={}", action.description());
                action.compensation().run();
            } catch (IOException | RuntimeException e) {
                log.error("transaction.compensationFailed description={} error={}",
                        action.description(), e.getMessage());
                if (failure != null) {
                    failure.addSuppressed(e);
                }
            }
        }
    }

    private record CompensatingAction(String description, Step compensation) {}
}
