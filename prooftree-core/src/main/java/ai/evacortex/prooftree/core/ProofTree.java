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
import ai.evacortex.prooftree.core.util.HashingUtil;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * One fully elaborated proof step: a statement applied to the proofs of its
 * hypotheses. Instances are immutable and are shared between every parent step that
 * uses them, so a proof forms a DAG.
 *
 * <p>The digest is computed once from the address and the children's digests. It is
 * the {@link #hashCode()} source and a fast inequality check; {@link #equals(Object)}
 * is always a full structural comparison.</p>
 */
public final class ProofTree {

    private final StatementAddress address;
    private final List<ProofTree> children;
    private final long digest;

    public ProofTree(StatementAddress address, List<ProofTree> children) {
        this(Objects.requireNonNull(address, "address"), children, HashingUtil.treeDigest(address, children));
    }

    /** Trusts {@code digest}; equal trees must still be given equal digests. */
    ProofTree(StatementAddress address, List<ProofTree> children, long digest) {
        this.address = Objects.requireNonNull(address, "address");
        this.children = List.copyOf(children);
        this.digest = digest;
    }

    /** The axiom/theorem being applied at the root. */
    public StatementAddress address() {
        return address;
    }

    /** The hypotheses ($e and $f) in database order. */
    public List<ProofTree> children() {
        return children;
    }

    public long digest() {
        return digest;
    }

    public int arity() {
        return children.size();
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProofTree other)) return false;
        return structurallyEqual(this, other);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(digest);
    }

    /** Shallow form {@code segment:index/arity#digest}; children are not rendered. */
    @Override
    public String toString() {
        return address + "/" + children.size() + "#" + Long.toHexString(digest);
    }

    // Explicit stack: proofs of set.mm size nest thousands of steps deep.
    private static boolean structurallyEqual(ProofTree a, ProofTree b) {
        Deque<ProofTree> pending = new ArrayDeque<>();
        pending.push(a);
        pending.push(b);
        while (!pending.isEmpty()) {
            ProofTree y = pending.pop();
            ProofTree x = pending.pop();
            if (x == y) continue;
            if (x.digest != y.digest
                    || !x.address.equals(y.address)
                    || x.children.size() != y.children.size()) {
                return false;
            }
            for (int i = 0; i < x.children.size(); i++) {
                pending.push(x.children.get(i));
                pending.push(y.children.get(i));
            }
        }
        return true;
    }
}
