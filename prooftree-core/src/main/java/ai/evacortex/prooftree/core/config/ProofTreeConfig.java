/*
 * ProofTree — Metamath Proof Object Core
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.prooftree.core.config;

/**
 * Tunables read once from system properties.
 *
 * <ul>
 *   <li>{@code prooftree.hash.seed} seed of the node digest, any int (hex with {@code 0x});</li>
 *   <li>{@code prooftree.table.initialCapacity} expected number of distinct steps per proof;</li>
 *   <li>{@code prooftree.cache.maxSize} number of finished proofs kept by {@code ProofTreeCache}.</li>
 * </ul>
 *
 * Digests are only meaningful inside one process, so changing the seed between runs is safe.
 */
public record ProofTreeConfig(int hashSeed, int initialCapacity, long cacheMaxSize) {

    public static final int DEFAULT_HASH_SEED = 0x9747b28c;
    public static final int DEFAULT_INITIAL_CAPACITY = 64;
    public static final long DEFAULT_CACHE_MAX_SIZE = 256;

    private static final ProofTreeConfig SYSTEM = fromSystemProperties();

    public ProofTreeConfig {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be >= 0: " + initialCapacity);
        }
        if (cacheMaxSize < 0) {
            throw new IllegalArgumentException("cacheMaxSize must be >= 0: " + cacheMaxSize);
        }
    }

    public static ProofTreeConfig system() {
        return SYSTEM;
    }

    public static ProofTreeConfig defaults() {
        return new ProofTreeConfig(DEFAULT_HASH_SEED, DEFAULT_INITIAL_CAPACITY, DEFAULT_CACHE_MAX_SIZE);
    }

    static ProofTreeConfig fromSystemProperties() {
        // unsigned hex such as 0x9747b28c is out of Integer.decode's range
        int seed = (int) (long) Long.decode(System.getProperty("prooftree.hash.seed",
                Integer.toString(DEFAULT_HASH_SEED)));
        int capacity = Integer.parseInt(System.getProperty("prooftree.table.initialCapacity",
                Integer.toString(DEFAULT_INITIAL_CAPACITY)));
        long maxSize = Long.parseLong(System.getProperty("prooftree.cache.maxSize",
                Long.toString(DEFAULT_CACHE_MAX_SIZE)));
        return new ProofTreeConfig(seed, capacity, maxSize);
    }
}
