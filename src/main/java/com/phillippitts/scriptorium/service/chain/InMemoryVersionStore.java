package com.phillippitts.scriptorium.service.chain;

import com.phillippitts.scriptorium.domain.TranscriptionVersion;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link VersionStore}.
 */
@Component
public class InMemoryVersionStore implements VersionStore {

    private final AtomicLong sequence = new AtomicLong();
    private final ConcurrentMap<Long, TranscriptionVersion> versions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<Long>> idsByAsset = new ConcurrentHashMap<>();

    @Override
    public long nextId() {
        return sequence.incrementAndGet();
    }

    @Override
    public void insert(TranscriptionVersion version) {
        Objects.requireNonNull(version, "version");
        if (versions.putIfAbsent(version.id(), version) != null) {
            throw new IllegalStateException("Version " + version.id() + " already exists");
        }
        idsByAsset.computeIfAbsent(version.assetId(), k -> new CopyOnWriteArrayList<>()).add(version.id());
    }

    @Override
    public void restamp(TranscriptionVersion version) {
        Objects.requireNonNull(version, "version");
        versions.compute(version.id(), (id, stored) -> {
            if (stored == null) {
                throw new IllegalStateException("Version " + id + " does not exist");
            }
            if (!sameContent(stored, version)) {
                throw new IllegalStateException("Version " + id + " content is immutable");
            }
            return version;
        });
    }

    @Override
    public Optional<TranscriptionVersion> find(long id) {
        return Optional.ofNullable(versions.get(id));
    }

    @Override
    public List<TranscriptionVersion> findByAsset(String assetId) {
        List<Long> ids = idsByAsset.getOrDefault(assetId, List.of());
        List<TranscriptionVersion> result = new ArrayList<>(ids.size());
        for (Long id : ids) {
            result.add(versions.get(id));
        }
        return result;
    }

    private static boolean sameContent(TranscriptionVersion a, TranscriptionVersion b) {
        return a.assetId().equals(b.assetId())
                && a.text().equals(b.text())
                && a.author().equals(b.author())
                && a.createdAt().equals(b.createdAt())
                && Objects.equals(a.supersedes(), b.supersedes())
                && a.ocrGenerated() == b.ocrGenerated()
                && a.ocrOriginated() == b.ocrOriginated();
    }
}
