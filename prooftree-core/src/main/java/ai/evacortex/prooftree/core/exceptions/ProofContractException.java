/*
 * ProofTree — Metamath Proof Object Core
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.prooftree.core.exceptions;

/**
 * The verification engine returned a step this table never built.
 * Not a verification failure: the engine and the table disagree about who owns the nodes.
 */
public class ProofContractException extends IllegalStateException {
    public ProofContractException(String message) {
        super("Proof builder contract violated: " + message);
    }
}
