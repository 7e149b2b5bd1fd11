/*
 * ProofTree — Metamath Proof Object Core
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.prooftree.core;

import ai.evacortex.prooftree.core.db.StatementAddress;

import java.util.List;

/**
 * Receiver of completed proof steps. The verification engine depends on this
 * capability only, so it can be driven by a {@link ProofTreeArray} or by any other
 * step collector.
 *
 * @param <T> the handle the builder returns for a step; fed back as a child of later steps
 */
public interface ProofBuilder<T> {

    /**
     * Records one derived step.
     *
     * @param address  the axiom, theorem or hypothesis applied at this step
     * @param children handles of the hypotheses' proofs, in database order
     * @param expr     the step's conclusion as a packed math string (see {@code ExprCodec})
     * @return the handle representing this step
     */
    T build(StatementAddress address, List<T> children, byte[] expr);
}
