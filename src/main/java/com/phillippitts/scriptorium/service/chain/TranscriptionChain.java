package com.phillippitts.scriptorium.service.chain;

import com.phillippitts.scriptorium.domain.TranscriptionVersion;
import com.phillippitts.scriptorium.exception.InvalidTranscriptionException;
import com.phillippitts.scriptorium.exception.UnknownVersionException;
import com.phillippitts.scriptorium.service.asset.AssetRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only history of transcription text per asset.
 *
 * <p>Each appended version points back at the version it supersedes. The chain never edits or
 * deletes a version; moving the asset's active pointer (undo, redo, fork) is the job of
 * {@link com.phillippitts.scriptorium.service.asset.AssetStateMachine}.
 *
 * <p>Because a version may only supersede an older id, every walk along {@code supersedes}
 * terminates at a version with no predecessor.
 */
@Component
public class TranscriptionChain {

    private static final Logger LOG = LogManager.getLogger(TranscriptionChain.class);

    private final VersionStore store;
    private final AssetRegistry assets;
    private final Clock clock;

    public TranscriptionChain(VersionStore store, AssetRegistry assets, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.assets = Objects.requireNonNull(assets, "assets");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Writes a new version. Does not change which version is active.
     *
     * @param supersedes   id of the version replaced, or {@code null} for the first version
     * @param ocrGenerated whether the text came straight from the OCR engine
     * @throws InvalidTranscriptionException if {@code supersedes} is unknown or belongs to another asset
     */
    public TranscriptionVersion append(String assetId, String text, String author,
                                       Long supersedes, boolean ocrGenerated) {
        boolean ocrOriginated = ocrGenerated;
        if (supersedes != null) {
            TranscriptionVersion previous = store.find(supersedes)
                    .filter(v -> v.assetId().equals(assetId))
                    .orElseThrow(() -> new InvalidTranscriptionException("Invalid supersedes value: " + supersedes));
            ocrOriginated = ocrOriginated || previous.isOcrDerived();
        }
        TranscriptionVersion version = new TranscriptionVersion(
                store.nextId(), assetId, text, author, clock.instant(), supersedes,
                null, null, null, null, ocrGenerated, ocrOriginated);
        store.insert(version);
        LOG.debug("Appended version {} to asset {} (supersedes={})", version.id(), assetId, supersedes);
        return version;
    }

    /** The asset's active version, if it has one. */
    public Optional<TranscriptionVersion> active(String assetId) {
        return assets.find(assetId)
                .map(machine -> machine.activeVersionId())
                .flatMap(store::find);
    }

    public TranscriptionVersion get(long versionId) {
        return find(versionId).orElseThrow(() -> new UnknownVersionException(versionId));
    }

    public Optional<TranscriptionVersion> find(long versionId) {
        return store.find(versionId);
    }

    /** Persists new submission/review stamps on an existing version. */
    public void restamp(TranscriptionVersion version) {
        store.restamp(version);
    }

    /**
     * History reachable from the asset's active version, most recent first. Lazy and restartable:
     * each iteration walks the stored back-pointers afresh.
     */
    public Iterable<TranscriptionVersion> history(String assetId) {
        return () -> new ChainIterator(assets.find(assetId).map(machine -> machine.activeVersionId()).orElse(null));
    }

    /** History reachable from {@code headId}, most recent first. */
    public Iterable<TranscriptionVersion> historyFrom(Long headId) {
        return () -> new ChainIterator(headId);
    }

    /** Distinct authors and reviewers over every version of the asset, forked branches included. */
    public int contributorCount(String assetId) {
        Set<String> contributors = new HashSet<>();
        for (TranscriptionVersion v : store.findByAsset(assetId)) {
            contributors.add(v.author());
            if (v.reviewer() != null) {
                contributors.add(v.reviewer());
            }
        }
        return contributors.size();
    }

    private final class ChainIterator implements Iterator<TranscriptionVersion> {
        private Long next;

        private ChainIterator(Long head) {
            this.next = head;
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public TranscriptionVersion next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            TranscriptionVersion current = get(next);
            next = current.supersedes();
            return current;
        }
    }
}
