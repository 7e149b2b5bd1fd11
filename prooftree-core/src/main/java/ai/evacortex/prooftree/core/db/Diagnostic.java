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
 * Verification failure as reported by the engine. The proof core never inspects it.
 *
 * @param code    engine-defined classification, e.g. {@code "StepUsedBeforeDefinition"}
 * @param message human readable detail
 */
public record Diagnostic(String code, String message) implements Serializable {

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
