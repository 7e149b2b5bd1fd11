/*
 * ProofTree — Metamath Proof Object Core
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.prooftree.core.engine;

import ai.evacortex.prooftree.core.ProofBuilder;
import ai.evacortex.prooftree.core.db.Nameset;
import ai.evacortex.prooftree.core.db.ScopeResult;
import ai.evacortex.prooftree.core.db.SegmentSet;
import ai.evacortex.prooftree.core.db.StatementRef;
import ai.evacortex.prooftree.core.exceptions.VerificationFailedException;

/**
 * {@code VerificationEngine} is the stepwise proof checker that replays the RPN or
 * compressed proof of a single {@code $p} statement.
 *
 * <p>For every step it derives, the engine must call
 * {@link ProofBuilder#build(ai.evacortex.prooftree.core.db.StatementAddress, java.util.List, byte[])}
 * exactly once, in step order, passing the items previously returned by that same
 * builder as children. Steps referenced again through a compressed-proof back-reference
 * reuse the earlier item instead of calling the builder a second time.</p>
 *
 * @see ProofBuilder
 */
public interface VerificationEngine {

    /**
     * Verifies one statement while recording its steps in {@code builder}.
     *
     * @param segments  parsed database
     * @param names     label table
     * @param scopes    frames of every statement
     * @param builder   receiver of the proof steps
     * @param statement the {@code $p} statement to verify
     * @param <T>       item type produced by {@code builder}
     * @return the builder item of the final step, i.e. the statement's conclusion
     * @throws VerificationFailedException if the proof is faulty
     */
    <T> T verifyOne(SegmentSet segments,
                    Nameset names,
                    ScopeResult scopes,
                    ProofBuilder<T> builder,
                    StatementRef statement) throws VerificationFailedException;
}
