/*
 * ProofTree — Metamath Proof Object Core
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.prooftree.core;

import ai.evacortex.prooftree.core.ScriptedVerificationEngine.Step;
import ai.evacortex.prooftree.core.db.Diagnostic;
import ai.evacortex.prooftree.core.db.Nameset;
import ai.evacortex.prooftree.core.db.ScopeResult;
import ai.evacortex.prooftree.core.db.SegmentSet;
import ai.evacortex.prooftree.core.db.StatementAddress;
import ai.evacortex.prooftree.core.db.StatementRef;
import ai.evacortex.prooftree.core.engine.VerificationEngine;
import ai.evacortex.prooftree.core.exceptions.ProofContractException;
import ai.evacortex.prooftree.core.exceptions.VerificationFailedException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static ai.evacortex.prooftree.core.ProofTreeTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class ProofTreeArrayVerificationTest {

    /** |- ( ph -> ph ) style proof where the second step uses the first one twice. */
    private static final Step[] REUSING_PROOF = {
            Step.apply(WPH, 0, "wff ph"),
            Step.apply(WPH, 0, "wff ph"),
            Step.apply(WI, 2, "wff ( ph -> ph )")
    };

    /** mp2-like proof: min, maj and the two wffs combined by ax-mp. */
    private static final Step[] MODUS_PONENS_PROOF = {
            Step.apply(WPH, 0, "wff ph"),
            Step.apply(WPS, 0, "wff ps"),
            Step.apply(MIN, 0, "|- ph"),
            Step.apply(MAJ, 0, "|- ( ph -> ps )"),
            Step.apply(AX_MP, 4, "|- ps")
    };

    private static ProofTreeArray verify(VerificationEngine engine, String label) {
        return ProofTreeArray.fromStatement(engine, NO_SEGMENTS, NO_NAMES, NO_SCOPES, statement(label));
    }

    @Test
    void testFromStatement_sharedStepCollapses() {
        ScriptedVerificationEngine engine = new ScriptedVerificationEngine().prove("idwff", REUSING_PROOF);

        ProofTreeArray arr = verify(engine, "idwff");

        assertEquals(2, arr.size(), "Repeated step must be stored once");
        assertEquals(1, arr.qed(), "Conclusion is the top entry");
        assertEquals(" wff ( ph -> ph )", arr.exprString(arr.qed()));
        assertSame(arr.get(0), arr.qedTree().children().get(0));
        assertSame(arr.get(0), arr.qedTree().children().get(1));
    }

    @Test
    void testFromStatement_backReferenceSkipsBuilder() {
        ScriptedVerificationEngine engine = new ScriptedVerificationEngine().prove("idwff",
                Step.apply(WPH, 0, "wff ph"),
                Step.reuse(0),
                Step.apply(WI, 2, "wff ( ph -> ph )"));

        ProofTreeArray arr = verify(engine, "idwff");

        assertEquals(2, arr.size());
        assertEquals(1, arr.qed());
    }

    @Test
    void testFromStatement_modusPonens() {
        ScriptedVerificationEngine engine = new ScriptedVerificationEngine().prove("mp2", MODUS_PONENS_PROOF);

        ProofTreeArray arr = verify(engine, "mp2");

        assertEquals(5, arr.size());
        assertEquals(4, arr.qed());
        assertEquals(" |- ps", arr.exprString(4));
        assertEquals(List.of(WPH, WPS, MIN, MAJ, AX_MP), arr.toRpn());
        assertArrayEquals(new int[]{1, 1, 1, 1, 1}, arr.countUses());
        assertArrayEquals(new int[]{0, 0, 0, 0, 1}, arr.heights());
    }

    @Test
    void testToRpn_expandsSharedSteps() {
        ScriptedVerificationEngine engine = new ScriptedVerificationEngine().prove("idwff", REUSING_PROOF);

        ProofTreeArray arr = verify(engine, "idwff");

        assertEquals(List.of(WPH, WPH, WI), arr.toRpn());
        assertArrayEquals(new int[]{2, 1}, arr.countUses(), "Shared leaf is used twice, qed once");
    }

    @Test
    void testFromStatement_propagatesEngineFailureUnchanged() {
        VerificationFailedException thrown = new VerificationFailedException(statement("bad"),
                new Diagnostic("ProofDvViolation", "ph and ps share a variable"));
        VerificationEngine engine = new VerificationEngine() {
            @Override
            public <T> T verifyOne(SegmentSet segments, Nameset names, ScopeResult scopes,
                                   ProofBuilder<T> builder, StatementRef statement) {
                throw thrown;
            }
        };

        VerificationFailedException caught = assertThrows(VerificationFailedException.class,
                () -> verify(engine, "bad"));

        assertSame(thrown, caught, "Engine failures must not be wrapped");
        assertEquals("ProofDvViolation", caught.getDiagnostic().code());
    }

    @Test
    void testFromStatement_scriptErrorsSurfaceAsDiagnostics() {
        ScriptedVerificationEngine engine = new ScriptedVerificationEngine()
                .prove("underflow", Step.apply(AX_MP, 4, "|- ps"))
                .prove("excess", Step.apply(WPH, 0, "wff ph"), Step.apply(WPS, 0, "wff ps"));

        assertEquals("ProofUnderflow",
                assertThrows(VerificationFailedException.class, () -> verify(engine, "underflow"))
                        .getDiagnostic().code());
        assertEquals("ProofExcessEnd",
                assertThrows(VerificationFailedException.class, () -> verify(engine, "excess"))
                        .getDiagnostic().code());
    }

    @Test
    void testFromStatement_foreignConclusionIsContractViolation() {
        VerificationEngine rogue = new VerificationEngine() {
            @Override
            @SuppressWarnings("unchecked")
            public <T> T verifyOne(SegmentSet segments, Nameset names, ScopeResult scopes,
                                   ProofBuilder<T> builder, StatementRef statement) {
                builder.build(WPH, new ArrayList<>(), new byte[0]);
                return (T) node(WI, leaf(WPS));
            }
        };

        ProofContractException ex = assertThrows(ProofContractException.class, () -> verify(rogue, "rogue"));
        assertInstanceOf(IllegalStateException.class, ex);
    }

    @Test
    void testFromStatement_engineMayUseAnyBuilder() {
        ScriptedVerificationEngine engine = new ScriptedVerificationEngine().prove("mp2", MODUS_PONENS_PROOF);
        List<StatementAddress> calls = new ArrayList<>();
        ProofBuilder<Integer> counting = (address, children, expr) -> {
            calls.add(address);
            return 1 + children.stream().mapToInt(Integer::intValue).sum();
        };

        Integer steps = engine.verifyOne(NO_SEGMENTS, NO_NAMES, NO_SCOPES, counting, statement("mp2"));

        assertEquals(5, steps);
        assertEquals(List.of(WPH, WPS, MIN, MAJ, AX_MP), calls);
    }
}
