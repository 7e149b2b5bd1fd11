/*
 * ProofTree — Metamath Proof Object Core
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.prooftree.core.db;

import java.util.Optional;

/**
 * Label table produced by the name checker.
 */
public interface Nameset {
    Optional<StatementAddress> lookupLabel(String label);
}
