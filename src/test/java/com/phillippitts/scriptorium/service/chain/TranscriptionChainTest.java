package com.phillippitts.scriptorium.service.chain;

import com.phillippitts.scriptorium.domain.TranscriptionVersion;
import com.phillippitts.scriptorium.exception.InvalidTranscriptionException;
import com.phillippitts.scriptorium.exception.UnknownVersionException;
import com.phillippitts.scriptorium.service.asset.AssetRegistry;
import com.phillippitts.scriptorium.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptionChainTest {

    private AssetRegistry assets;
    private InMemoryVersionStore store;
    private TranscriptionChain chain;

    @BeforeEach
    void setUp() {
        assets = new AssetRegistry();
        store = new InMemoryVersionStore();
        chain = new TranscriptionChain(store, assets, MutableClock.startingAt("2026-01-01T10:00:00Z"));
    }

    /** Appends and moves the asset's pointer, as the workflow does. */
    private TranscriptionVersion saveActive(String text, Long supersedes) {
        TranscriptionVersion v = chain.append("42", text, "alice", supersedes, false);
        assets.get("42").advance(v.id());
        return v;
    }

    @Test
    void historyIsMostRecentFirstAndEndsAtRoot() {
        TranscriptionVersion v1 = saveActive("Hello", null);
        TranscriptionVersion v2 = saveActive("Hello world", v1.id());
        TranscriptionVersion v3 = saveActive("Hello, world", v2.id());

        assertThat(chain.history("42"))
                .extracting(TranscriptionVersion::id)
                .containsExactly(v3.id(), v2.id(), v1.id());
    }

    @Test
    void historyIsRestartableAndReflectsPointerMoves() {
        TranscriptionVersion v1 = saveActive("a", null);
        TranscriptionVersion v2 = saveActive("b", v1.id());
        Iterable<TranscriptionVersion> history = chain.history("42");

        assertThat(history).hasSize(2);
        assertThat(history).hasSize(2);

        TranscriptionVersion v3 = saveActive("c", v2.id());
        assertThat(history).extracting(TranscriptionVersion::id).startsWith(v3.id());
    }

    @Test
    void historyIsLazy() {
        TranscriptionVersion v1 = saveActive("a", null);
        saveActive("b", v1.id());

        Iterator<TranscriptionVersion> it = chain.history("42").iterator();
        assertThat(it.next().text()).isEqualTo("b");
        assertThat(it.hasNext()).isTrue();
        assertThat(it.next().text()).isEqualTo("a");
        assertThat(it.hasNext()).isFalse();
        assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void historyOfUnknownAssetIsEmpty() {
        assertThat(chain.history("nope")).isEmpty();
        assertThat(chain.active("nope")).isEmpty();
    }

    @Test
    void everyWalkTerminatesAtVersionWithoutPredecessor() {
        Long head = null;
        for (int i = 0; i < 50; i++) {
            head = saveActive("v" + i, head).id();
        }

        Set<Long> seen = new HashSet<>();
        TranscriptionVersion last = null;
        for (TranscriptionVersion v : chain.history("42")) {
            assertThat(seen.add(v.id())).isTrue();
            last = v;
        }
        assertThat(seen).hasSize(50);
        assertThat(last.supersedes()).isNull();
    }

    @Test
    void rejectsSupersedesFromAnotherAssetOrUnknownId() {
        TranscriptionVersion other = chain.append("99", "elsewhere", "bob", null, false);

        assertThatThrownBy(() -> chain.append("42", "x", "alice", other.id(), false))
                .isInstanceOf(InvalidTranscriptionException.class);
        assertThatThrownBy(() -> chain.append("42", "x", "alice", 12345L, false))
                .isInstanceOf(InvalidTranscriptionException.class);
        assertThat(store.findByAsset("42")).isEmpty();
    }

    @Test
    void ocrOriginIsInheritedBySuccessors() {
        TranscriptionVersion ocr = chain.append("42", "OCR text", "alice", null, true);
        TranscriptionVersion edited = chain.append("42", "OCR text, fixed", "alice", ocr.id(), false);
        TranscriptionVersion again = chain.append("42", "OCR text, fixed twice", "alice", edited.id(), false);

        assertThat(ocr.ocrGenerated()).isTrue();
        assertThat(edited.ocrGenerated()).isFalse();
        assertThat(edited.ocrOriginated()).isTrue();
        assertThat(again.ocrOriginated()).isTrue();
    }

    @Test
    void contributorsCountAuthorsAndReviewersAcrossForks() {
        TranscriptionVersion v1 = chain.append("42", "a", "alice", null, false);
        chain.append("42", "b", "carol", v1.id(), false);
        chain.append("42", "fork", "alice", v1.id(), false);
        chain.restamp(chain.get(v1.id()).submitted(v1.createdAt()).rejected("bob", v1.createdAt()));

        assertThat(chain.contributorCount("42")).isEqualTo(3);
    }

    @Test
    void restampKeepsTextAndRejectsContentChanges() {
        TranscriptionVersion v1 = chain.append("42", "a", "alice", null, false);
        chain.restamp(v1.submitted(v1.createdAt()));

        assertThat(chain.get(v1.id()).submittedAt()).isNotNull();
        TranscriptionVersion tampered = new TranscriptionVersion(v1.id(), "42", "changed", "alice",
                v1.createdAt(), null, null, null, null, null, false, false);
        assertThatThrownBy(() -> chain.restamp(tampered)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void unknownVersionIdIsReported() {
        assertThatThrownBy(() -> chain.get(777)).isInstanceOf(UnknownVersionException.class);
        assertThat(chain.find(777)).isEmpty();
    }

    @Test
    void idsIncreaseAcrossAssets() {
        List<Long> ids = new ArrayList<>();
        ids.add(chain.append("1", "a", "alice", null, false).id());
        ids.add(chain.append("2", "b", "bob", null, false).id());
        ids.add(chain.append("1", "c", "alice", ids.get(0), false).id());

        assertThat(ids).isSorted().doesNotHaveDuplicates();
    }
}
