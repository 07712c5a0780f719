package com.phillippitts.scriptorium.service.review;

import com.phillippitts.scriptorium.config.properties.ReviewProperties;
import com.phillippitts.scriptorium.domain.ReviewAction;
import com.phillippitts.scriptorium.domain.TranscriptionStatus;
import com.phillippitts.scriptorium.domain.TranscriptionVersion;
import com.phillippitts.scriptorium.exception.HistoryUnavailableException;
import com.phillippitts.scriptorium.exception.InvalidTranscriptionException;
import com.phillippitts.scriptorium.exception.NotAuthorizedException;
import com.phillippitts.scriptorium.service.asset.AssetRegistry;
import com.phillippitts.scriptorium.service.asset.AssetStateMachine;
import com.phillippitts.scriptorium.service.chain.TranscriptionChain;
import com.phillippitts.scriptorium.service.events.ReservationReleasedEvent;
import com.phillippitts.scriptorium.service.events.TranscriptionStatusChangedEvent;
import com.phillippitts.scriptorium.service.ratelimit.SlidingWindowRateLimiter;
import com.phillippitts.scriptorium.service.reservation.ReservationManager;
import com.phillippitts.scriptorium.util.AssetLogContext;
import com.phillippitts.scriptorium.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Save, submit, review, undo and redo of an asset's transcription.
 *
 * <p>Every mutation runs inside {@link AssetStateMachine#atomically} for its asset and re-validates
 * there, in this order: the asset's status allows the operation, the caller holds a live lease
 * (lease-gated operations only), and the version the caller acted on is still the active one. A
 * failed check throws before anything is written, so a rejected request never leaves a new
 * version behind.
 *
 * <p>Review is not lease-gated: reviewers act on submitted work without reserving it.
 */
@Service
public class TranscriptionWorkflow {

    private static final Logger LOG = LogManager.getLogger(TranscriptionWorkflow.class);

    private static final Pattern URL = Pattern.compile("(?i)\\b(?:https?://|ftp://|www\\.)\\S+");

    private final ReservationManager reservations;
    private final TranscriptionChain chain;
    private final AssetRegistry assets;
    private final ReviewProperties props;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final SlidingWindowRateLimiter acceptLimiter;

    public TranscriptionWorkflow(ReservationManager reservations,
                                 TranscriptionChain chain,
                                 AssetRegistry assets,
                                 ReviewProperties props,
                                 ApplicationEventPublisher publisher,
                                 Clock clock) {
        this.reservations = Objects.requireNonNull(reservations, "reservations");
        this.chain = Objects.requireNonNull(chain, "chain");
        this.assets = Objects.requireNonNull(assets, "assets");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.acceptLimiter = new SlidingWindowRateLimiter(props.getAcceptsPerWindow(), props.getWindow(), clock);
    }

    /**
     * Writes a new version and makes it active.
     *
     * @param text       full text; empty marks a page with nothing to transcribe
     * @param supersedes the version the caller edited, or {@code null} if the caller saw none
     */
    public TranscriptionOutcome save(String assetId, String text, Long supersedes, String author) {
        if (text == null) {
            throw new InvalidTranscriptionException("text is required");
        }
        if (props.isRejectUrls() && URL.matcher(text).find()) {
            throw new InvalidTranscriptionException(
                    "It looks like your transcription contains URLs. Please remove the URLs and try again.");
        }
        AssetStateMachine machine = assets.get(assetId);
        try (AssetLogContext ignored = AssetLogContext.bind(assetId)) {
            Transition result = machine.atomically(() -> {
                TranscriptionStatus from = machine.status();
                requireEditableWithLease(machine, "save", author);
                requireCurrent(machine, supersedes);
                TranscriptionVersion version = chain.append(assetId, text, author, supersedes, false);
                machine.advance(version.id());
                return new Transition(version, from);
            });
            LOG.info("Saved version {} by {}: {}", result.version.id(), author, LogSanitizer.preview(text));
            return publish(machine, result, "save", author);
        }
    }

    /**
     * Submits the active version for review.
     *
     * @param versionId the version the caller believes is active
     */
    public TranscriptionOutcome submit(long versionId, String actor) {
        TranscriptionVersion target = chain.get(versionId);
        String assetId = target.assetId();
        AssetStateMachine machine = assets.get(assetId);
        try (AssetLogContext ignored = AssetLogContext.bind(assetId)) {
            Transition result = machine.atomically(() -> {
                TranscriptionStatus from = machine.status();
                reservations.requireLease(assetId, actor);
                if (!target.author().equals(actor)) {
                    throw new NotAuthorizedException(actor, "Only the author of a transcription may submit it");
                }
                machine.submit(versionId);
                TranscriptionVersion stamped = chain.get(versionId).submitted(clock.instant());
                chain.restamp(stamped);
                return new Transition(stamped, from);
            });
            return publish(machine, result, "submit", actor);
        }
    }

    /**
     * Accepts or rejects a submitted version. Acceptance completes the asset and releases any lease
     * on it; rejection reopens it for editing and leaves the lease as it is.
     *
     * @throws NotAuthorizedException if the reviewer authored the version
     */
    public TranscriptionOutcome review(long versionId, String reviewer, ReviewAction action) {
        Objects.requireNonNull(action, "action");
        TranscriptionVersion target = chain.get(versionId);
        String assetId = target.assetId();
        if (target.author().equals(reviewer)) {
            throw new NotAuthorizedException(reviewer, "You cannot review your own transcription");
        }
        if (action == ReviewAction.ACCEPT) {
            acceptLimiter.acquire(reviewer, "accept");
        }
        AssetStateMachine machine = assets.get(assetId);
        try (AssetLogContext ignored = AssetLogContext.bind(assetId)) {
            Transition result;
            try {
                result = machine.atomically(() -> reviewTransition(machine, versionId, action, reviewer));
            } catch (RuntimeException e) {
                // a refused review does not count against the reviewer's accept quota
                if (action == ReviewAction.ACCEPT) {
                    acceptLimiter.refund(reviewer);
                }
                throw e;
            }
            if (action == ReviewAction.ACCEPT) {
                reservations.releaseAll(assetId, ReservationReleasedEvent.Reason.COMPLETED);
            }
            return publish(machine, result, action.wireName(), reviewer);
        }
    }

    private Transition reviewTransition(AssetStateMachine machine, long versionId, ReviewAction action, String reviewer) {
        TranscriptionStatus from = machine.status();
        TranscriptionVersion stamped;
        if (action == ReviewAction.ACCEPT) {
            machine.accept(versionId);
            stamped = chain.get(versionId).accepted(reviewer, clock.instant());
        } else {
            machine.reject(versionId);
            stamped = chain.get(versionId).rejected(reviewer, clock.instant());
        }
        chain.restamp(stamped);
        return new Transition(stamped, from);
    }

    /**
     * Undo: makes the active version's predecessor active again. No version is written.
     *
     * @throws HistoryUnavailableException if the active version has no predecessor
     */
    public TranscriptionOutcome rollback(String assetId, String actor) {
        AssetStateMachine machine = assets.get(assetId);
        try (AssetLogContext ignored = AssetLogContext.bind(assetId)) {
            Transition result = machine.atomically(() -> {
                TranscriptionStatus from = machine.status();
                requireEditableWithLease(machine, "undo", actor);
                TranscriptionVersion active = chain.active(assetId)
                        .filter(v -> v.supersedes() != null)
                        .orElseThrow(() -> new HistoryUnavailableException(
                                assetId, "No previous transcription available"));
                machine.rewind(active.id(), active.supersedes(), actor);
                return new Transition(chain.get(active.supersedes()), from);
            });
            return publish(machine, result, "undo", actor);
        }
    }

    /**
     * Redo: re-activates the version most recently left by the caller's undo.
     *
     * @throws HistoryUnavailableException if there is nothing to restore
     */
    public TranscriptionOutcome rollforward(String assetId, String actor) {
        AssetStateMachine machine = assets.get(assetId);
        try (AssetLogContext ignored = AssetLogContext.bind(assetId)) {
            Transition result = machine.atomically(() -> {
                TranscriptionStatus from = machine.status();
                requireEditableWithLease(machine, "redo", actor);
                long restored = machine.replay(actor);
                return new Transition(chain.get(restored), from);
            });
            return publish(machine, result, "redo", actor);
        }
    }

    /**
     * Checks that {@code actor} could write OCR output over {@code supersedes} right now. Called before
     * the engine runs so that a doomed request does not consume engine time; {@link #recordOcr}
     * checks again.
     */
    public void checkWritable(String assetId, Long supersedes, String actor) {
        AssetStateMachine machine = assets.get(assetId);
        machine.atomically(() -> {
            requireEditableWithLease(machine, "ocr", actor);
            requireCurrent(machine, supersedes);
            return null;
        });
    }

    /**
     * Writes OCR output as the new active version. When the asset has no version yet, an empty
     * placeholder is written first so the OCR text can be undone.
     */
    public TranscriptionOutcome recordOcr(String assetId, String text, Long supersedes, String actor) {
        Objects.requireNonNull(text, "text");
        AssetStateMachine machine = assets.get(assetId);
        try (AssetLogContext ignored = AssetLogContext.bind(assetId)) {
            Transition result = machine.atomically(() -> {
                TranscriptionStatus from = machine.status();
                requireEditableWithLease(machine, "ocr", actor);
                requireCurrent(machine, supersedes);
                Long base = supersedes;
                if (base == null) {
                    TranscriptionVersion placeholder = chain.append(assetId, "", actor, null, false);
                    machine.advance(placeholder.id());
                    base = placeholder.id();
                }
                TranscriptionVersion version = chain.append(assetId, text, actor, base, true);
                machine.advance(version.id());
                return new Transition(version, from);
            });
            LOG.info("Recorded OCR version {} by {}: {}", result.version.id(), actor, LogSanitizer.preview(text));
            return publish(machine, result, "ocr", actor);
        }
    }

    /**
     * Current state of an asset as seen by {@code viewer}. Never registers or mutates anything.
     *
     * @param viewer caller identity, or {@code null}; only affects redo availability
     */
    public AssetOverview describe(String assetId, String viewer) {
        return assets.find(assetId)
                .map(machine -> machine.atomically(() -> {
                    TranscriptionStatus status = machine.status();
                    return new AssetOverview(
                            assetId,
                            status,
                            chain.active(assetId),
                            reservations.currentLease(assetId),
                            undoAvailable(machine),
                            viewer != null && machine.canRedo(viewer),
                            chain.contributorCount(assetId));
                }))
                .orElseGet(() -> new AssetOverview(
                        assetId, TranscriptionStatus.NOT_STARTED, Optional.empty(),
                        reservations.currentLease(assetId), false, false, 0));
    }

    private void requireEditableWithLease(AssetStateMachine machine, String operation, String actor) {
        machine.requireEditable(operation);
        reservations.requireLease(machine.assetId(), actor);
    }

    /** Unknown or foreign ids are malformed (400); a valid but outdated id is a conflict (409). */
    private void requireCurrent(AssetStateMachine machine, Long supersedes) {
        if (supersedes != null) {
            chain.find(supersedes)
                    .filter(v -> v.assetId().equals(machine.assetId()))
                    .orElseThrow(() -> new InvalidTranscriptionException("Invalid supersedes value: " + supersedes));
        }
        machine.requireActive(supersedes);
    }

    private boolean undoAvailable(AssetStateMachine machine) {
        return machine.status().isEditable()
                && chain.active(machine.assetId()).map(v -> v.supersedes() != null).orElse(false);
    }

    private TranscriptionOutcome publish(AssetStateMachine machine, Transition result, String operation, String actor) {
        TranscriptionOutcome outcome = machine.atomically(() -> new TranscriptionOutcome(
                result.version,
                machine.status(),
                undoAvailable(machine),
                machine.canRedo(actor),
                chain.contributorCount(machine.assetId())));
        publisher.publishEvent(new TranscriptionStatusChangedEvent(
                machine.assetId(), result.version.id(), result.from, outcome.status(), operation, actor, clock.instant()));
        return outcome;
    }

    private record Transition(TranscriptionVersion version, TranscriptionStatus from) {
    }
}
