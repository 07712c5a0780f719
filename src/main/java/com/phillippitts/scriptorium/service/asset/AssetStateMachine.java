package com.phillippitts.scriptorium.service.asset;

import com.phillippitts.scriptorium.domain.TranscriptionStatus;
import com.phillippitts.scriptorium.exception.HistoryUnavailableException;
import com.phillippitts.scriptorium.exception.IllegalTransitionException;
import com.phillippitts.scriptorium.exception.StaleVersionException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Thread-safe state machine for one asset's review status and active-version pointer.
 *
 * <p>This is the single place where an asset's status and active version change. Callers that
 * must validate and write in one step (check lease, check version, append, swap pointer) wrap
 * the whole sequence in {@link #atomically(Supplier)}; the transition methods re-check their own
 * preconditions and throw rather than overwrite.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * NOT_STARTED | IN_PROGRESS → IN_PROGRESS (via advance, rewind, replay)
 * IN_PROGRESS → SUBMITTED (via submit)
 * SUBMITTED → COMPLETED (via accept)
 * SUBMITTED → IN_PROGRESS (via reject)
 * </pre>
 *
 * <p>The redo path holds versions left behind by undo, most recent on top. It belongs to the
 * editor who performed the undo and is discarded by any forward edit, by submission, or by an
 * undo from a different editor.
 *
 * <p><b>Thread Safety:</b> All public methods are thread-safe and use a {@link ReentrantLock}.
 */
public final class AssetStateMachine {

    private final String assetId;
    private final ReentrantLock lock = new ReentrantLock();

    private TranscriptionStatus status = TranscriptionStatus.NOT_STARTED;
    private Long activeVersionId;
    private final Deque<Long> redoPath = new ArrayDeque<>();
    private String redoOwner;

    AssetStateMachine(String assetId) {
        this.assetId = Objects.requireNonNull(assetId, "assetId cannot be null");
    }

    public String assetId() {
        return assetId;
    }

    /**
     * Runs {@code action} while holding this asset's lock. Reentrant, so the action may call
     * transition methods.
     */
    public <T> T atomically(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public TranscriptionStatus status() {
        return atomically(() -> status);
    }

    /** Active version id, or {@code null} before the first save. */
    public Long activeVersionId() {
        return atomically(() -> activeVersionId);
    }

    public AssetSnapshot snapshot() {
        return atomically(() -> new AssetSnapshot(assetId, status, activeVersionId, redoPath.size(), redoOwner));
    }

    /**
     * Throws unless the asset is in an editable state.
     *
     * @param operation name used in the error message
     */
    public void requireEditable(String operation) {
        atomically(() -> {
            if (!status.isEditable()) {
                throw new IllegalTransitionException(assetId, status, operation);
            }
            return null;
        });
    }

    /**
     * Throws unless {@code expected} is the active version. {@code null} expects no active version.
     */
    public void requireActive(Long expected) {
        atomically(() -> {
            if (!Objects.equals(expected, activeVersionId)) {
                String reason = expected == null
                        ? "An open transcription already exists"
                        : "This transcription has been superseded";
                throw new StaleVersionException(assetId, expected, activeVersionId, reason);
            }
            return null;
        });
    }

    /**
     * Makes a newly appended version active (save or OCR). Forks the chain: the redo path is discarded.
     */
    public void advance(long newVersionId) {
        atomically(() -> {
            requireEditable("save");
            moveTo(TranscriptionStatus.IN_PROGRESS, "save");
            activeVersionId = newVersionId;
            clearRedo();
            return null;
        });
    }

    /** IN_PROGRESS → SUBMITTED for the active version. */
    public void submit(long versionId) {
        atomically(() -> {
            requireStatus(TranscriptionStatus.IN_PROGRESS, "submit");
            requireActive(versionId);
            moveTo(TranscriptionStatus.SUBMITTED, "submit");
            clearRedo();
            return null;
        });
    }

    /** SUBMITTED → COMPLETED for the active version. */
    public void accept(long versionId) {
        atomically(() -> {
            requireStatus(TranscriptionStatus.SUBMITTED, "accept");
            requireActive(versionId);
            moveTo(TranscriptionStatus.COMPLETED, "accept");
            return null;
        });
    }

    /** SUBMITTED → IN_PROGRESS for the active version. The chain is left unchanged. */
    public void reject(long versionId) {
        atomically(() -> {
            requireStatus(TranscriptionStatus.SUBMITTED, "reject");
            requireActive(versionId);
            moveTo(TranscriptionStatus.IN_PROGRESS, "reject");
            return null;
        });
    }

    /**
     * Undo: moves the pointer from the active version back to {@code previousVersionId}, remembering
     * the left version so {@code actor} can redo it.
     */
    public void rewind(long expectedActive, long previousVersionId, String actor) {
        atomically(() -> {
            requireEditable("undo");
            requireActive(expectedActive);
            if (!Objects.equals(redoOwner, actor)) {
                clearRedo();
                redoOwner = actor;
            }
            redoPath.push(expectedActive);
            activeVersionId = previousVersionId;
            return null;
        });
    }

    /**
     * Redo: moves the pointer forward to the version most recently left by {@code actor}'s undo.
     *
     * @return the newly active version id
     * @throws HistoryUnavailableException if there is nothing to restore for this actor
     */
    public long replay(String actor) {
        return atomically(() -> {
            requireEditable("redo");
            if (!canRedo(actor)) {
                throw new HistoryUnavailableException(assetId, "No transcription to restore");
            }
            activeVersionId = redoPath.pop();
            return activeVersionId;
        });
    }

    public boolean canRedo(String actor) {
        return atomically(() -> !redoPath.isEmpty() && Objects.equals(redoOwner, actor) && status.isEditable());
    }

    private void requireStatus(TranscriptionStatus required, String operation) {
        if (status != required) {
            throw new IllegalTransitionException(assetId, status, operation);
        }
    }

    private void moveTo(TranscriptionStatus target, String operation) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalTransitionException(assetId, status, operation);
        }
        status = target;
    }

    private void clearRedo() {
        redoPath.clear();
        redoOwner = null;
    }
}
