package com.phillippitts.scriptorium.service.chain;

import com.phillippitts.scriptorium.domain.TranscriptionVersion;

import java.util.List;
import java.util.Optional;

/**
 * Arena of immutable transcription versions indexed by id.
 *
 * <p>Versions are inserted once and never deleted. {@link #restamp} may replace a stored version
 * with a copy differing only in submission/review stamps. Any method may throw
 * {@link com.phillippitts.scriptorium.exception.StoreUnavailableException}.
 */
public interface VersionStore {

    /** Reserves the next id; ids increase strictly across the whole store. */
    long nextId();

    /**
     * Stores a new version.
     *
     * @throws IllegalStateException if a version with the same id already exists
     */
    void insert(TranscriptionVersion version);

    /**
     * Replaces a stored version with a restamped copy of itself.
     *
     * @throws IllegalStateException if the id is unknown or content other than stamps differs
     */
    void restamp(TranscriptionVersion version);

    Optional<TranscriptionVersion> find(long id);

    /** All versions of an asset, including unreachable forked branches, oldest first. */
    List<TranscriptionVersion> findByAsset(String assetId);
}
