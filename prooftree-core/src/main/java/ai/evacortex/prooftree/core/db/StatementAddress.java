/*
 * ProofTree — Metamath Proof Object Core
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.prooftree.core.db;

import java.io.Serializable;

/**
 * Location of one statement in the database: the segment that declares it and its
 * position inside that segment. Issued by the parser; compared and hashed by value.
 */
public record StatementAddress(int segmentId, int index) implements Serializable {

    @Override
    public String toString() {
        return segmentId + ":" + index;
    }
}
