/*
 * ProofTree — Metamath Proof Object Core
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.prooftree.core.exceptions;

import ai.evacortex.prooftree.core.db.Diagnostic;
import ai.evacortex.prooftree.core.db.StatementRef;

public class VerificationFailedException extends RuntimeException {

    private final StatementRef statement;
    private final Diagnostic diagnostic;

    public VerificationFailedException(StatementRef statement, Diagnostic diagnostic) {
        super("Verification of '" + statement.label() + "' failed: " + diagnostic);
        this.statement = statement;
        this.diagnostic = diagnostic;
    }

    public StatementRef getStatement() {
        return statement;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
