/*
 * ProofTree — Metamath Proof Object Core
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.prooftree.core.cache;

import ai.evacortex.prooftree.core.ProofTreeArray;
import ai.evacortex.prooftree.core.config.ProofTreeConfig;
import ai.evacortex.prooftree.core.db.Nameset;
import ai.evacortex.prooftree.core.db.ScopeResult;
import ai.evacortex.prooftree.core.db.SegmentSet;
import ai.evacortex.prooftree.core.db.StatementAddress;
import ai.evacortex.prooftree.core.db.StatementRef;
import ai.evacortex.prooftree.core.engine.VerificationEngine;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the collected steps of recently requested statements, so that consumers
 * asking for the same proof several times (display, then re-compression) replay it
 * once. Every entry is a separate {@link ProofTreeArray}; no node is shared between
 * statements. Failed verifications are not cached.
 */
public class ProofTreeCache {

    private static final Logger logger = LoggerFactory.getLogger(ProofTreeCache.class);

    private final VerificationEngine engine;
    private final SegmentSet segments;
    private final Nameset names;
    private final ScopeResult scopes;
    private final Cache<StatementAddress, ProofTreeArray> cache;

    public ProofTreeCache(VerificationEngine engine, SegmentSet segments, Nameset names, ScopeResult scopes) {
        this(engine, segments, names, scopes, ProofTreeConfig.system().cacheMaxSize());
    }

    public ProofTreeCache(VerificationEngine engine,
                          SegmentSet segments,
                          Nameset names,
                          ScopeResult scopes,
                          long maximumSize) {
        this.engine = engine;
        this.segments = segments;
        this.names = names;
        this.scopes = scopes;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .executor(Runnable::run)
                .removalListener((StatementAddress k, ProofTreeArray v, RemovalCause c) ->
                        logger.debug("Dropped proof steps of {} ({})", k, c))
                .build();
    }

    public ProofTreeArray get(StatementRef statement) {
        return cache.get(statement.address(), address -> {
            logger.debug("Replaying proof of '{}' at {}", statement.label(), address);
            return ProofTreeArray.fromStatement(engine, segments, names, scopes, statement);
        });
    }

    public ProofTreeArray getIfPresent(StatementAddress address) {
        return cache.getIfPresent(address);
    }

    public void invalidate(StatementAddress address) {
        cache.invalidate(address);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
