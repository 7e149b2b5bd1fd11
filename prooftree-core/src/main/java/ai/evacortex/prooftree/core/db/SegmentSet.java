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
 * Parsed view of the database, owned by the parser layer.
 * The proof core only hands it through to the {@code VerificationEngine}.
 */
public interface SegmentSet {

    /**
     * Resolves an address to the statement stored there.
     *
     * @param address statement location
     * @return the statement, or empty if the address points past its segment
     */
    Optional<StatementRef> statement(StatementAddress address);
}
