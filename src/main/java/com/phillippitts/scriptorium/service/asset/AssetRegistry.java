package com.phillippitts.scriptorium.service.asset;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Holds one {@link AssetStateMachine} per asset.
 *
 * <p>Assets are catalogued elsewhere; an asset first seen here starts {@code NOT_STARTED} with no
 * active version. Machines are never removed.
 */
@Component
public class AssetRegistry {

    private final ConcurrentMap<String, AssetStateMachine> machines = new ConcurrentHashMap<>();

    public AssetStateMachine get(String assetId) {
        if (assetId == null || assetId.isBlank()) {
            throw new IllegalArgumentException("assetId must not be blank");
        }
        return machines.computeIfAbsent(assetId, AssetStateMachine::new);
    }

    /** Existing machine, without registering the asset. */
    public Optional<AssetStateMachine> find(String assetId) {
        return Optional.ofNullable(machines.get(assetId));
    }
}
