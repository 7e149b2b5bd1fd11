/*
 * ProofTree — Metamath Proof Object Core
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.prooftree.core.db;

/**
 * Frames (mandatory hypotheses and disjoint-variable constraints) computed by the
 * scope checker. Opaque to the proof core.
 */
public interface ScopeResult {
    boolean hasFrame(StatementAddress address);
}
