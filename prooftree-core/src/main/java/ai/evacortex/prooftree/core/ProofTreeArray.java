/*
 * ProofTree — Metamath Proof Object Core
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.prooftree.core;

import ai.evacortex.prooftree.core.config.ProofTreeConfig;
import ai.evacortex.prooftree.core.db.Nameset;
import ai.evacortex.prooftree.core.db.ScopeResult;
import ai.evacortex.prooftree.core.db.SegmentSet;
import ai.evacortex.prooftree.core.db.StatementAddress;
import ai.evacortex.prooftree.core.db.StatementRef;
import ai.evacortex.prooftree.core.engine.VerificationEngine;
import ai.evacortex.prooftree.core.exceptions.ProofContractException;
import ai.evacortex.prooftree.core.exceptions.VerificationFailedException;
import ai.evacortex.prooftree.core.util.ExprCodec;
import ai.evacortex.prooftree.core.util.HashingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.ToLongBiFunction;

/**
 * {@code ProofTreeArray} collects the distinct steps of one proof in the order the
 * verifier first produced them, together with the display form of each step's
 * conclusion.
 *
 * <p>As a {@link ProofBuilder} it hash-conses: building a step that is structurally
 * equal to one already stored returns the stored instance and leaves the table
 * unchanged. The digest index is a bucket map, so two different steps that happen to
 * share a digest still get separate positions.</p>
 *
 * <p>Not thread-safe. One table belongs to one verification run; once
 * {@link #fromStatement} returns, callers only read it.</p>
 */
public class ProofTreeArray implements ProofBuilder<ProofTree> {

    private static final Logger logger = LoggerFactory.getLogger(ProofTreeArray.class);

    private final ToLongBiFunction<StatementAddress, List<ProofTree>> digestFunction;
    private final Map<Long, List<Integer>> index;
    private final List<ProofTree> trees;
    private final List<byte[]> exprs;
    private int qed = -1;

    public ProofTreeArray() {
        this(ProofTreeConfig.system().initialCapacity());
    }

    public ProofTreeArray(int initialCapacity) {
        this(initialCapacity, HashingUtil::treeDigest);
    }

    ProofTreeArray(int initialCapacity, ToLongBiFunction<StatementAddress, List<ProofTree>> digestFunction) {
        this.digestFunction = digestFunction;
        this.index = new HashMap<>(initialCapacity);
        this.trees = new ArrayList<>(initialCapacity);
        this.exprs = new ArrayList<>(initialCapacity);
    }

    /**
     * Verifies {@code statement} and collects its proof steps.
     *
     * @return the filled table; {@link #qed()} is the position of the statement's conclusion
     * @throws VerificationFailedException propagated unchanged from the engine
     * @throws ProofContractException      if the engine returns a step it did not build here
     */
    public static ProofTreeArray fromStatement(VerificationEngine engine,
                                               SegmentSet segments,
                                               Nameset names,
                                               ScopeResult scopes,
                                               StatementRef statement) {
        ProofTreeArray arr = new ProofTreeArray();
        ProofTree conclusion = engine.verifyOne(segments, names, scopes, arr, statement);
        OptionalInt found = arr.index(conclusion);
        if (found.isEmpty()) {
            logger.error("Engine returned a step for '{}' that is not in its table ({} steps)",
                    statement.label(), arr.size());
            throw new ProofContractException("final step of '" + statement.label() + "' was not built by this table");
        }
        arr.qed = found.getAsInt();
        logger.debug("Collected {} distinct steps for '{}', qed at {}", arr.size(), statement.label(), arr.qed);
        return arr;
    }

    /**
     * Position of a step structurally equal to {@code tree}, if one is stored.
     */
    public OptionalInt index(ProofTree tree) {
        List<Integer> bucket = index.get(tree.digest());
        if (bucket == null) {
            return OptionalInt.empty();
        }
        for (int pos : bucket) {
            if (trees.get(pos).equals(tree)) {
                return OptionalInt.of(pos);
            }
        }
        return OptionalInt.empty();
    }

    @Override
    public ProofTree build(StatementAddress address, List<ProofTree> children, byte[] expr) {
        ProofTree tree = new ProofTree(address, children, digestFunction.applyAsLong(address, children));
        OptionalInt existing = index(tree);
        if (existing.isPresent()) {
            return trees.get(existing.getAsInt());
        }
        List<Integer> bucket = index.computeIfAbsent(tree.digest(), d -> new ArrayList<>(1));
        if (!bucket.isEmpty()) {
            logger.debug("Digest collision on {}: position {} shares it with {}",
                    Long.toHexString(tree.digest()), trees.size(), bucket);
        }
        bucket.add(trees.size());
        trees.add(tree);
        exprs.add(ExprCodec.unpack(expr));
        return tree;
    }

    public int size() {
        return trees.size();
    }

    /** Position of the proven statement's conclusion, or -1 if this table was not filled by {@link #fromStatement}. */
    public int qed() {
        return qed;
    }

    public ProofTree qedTree() {
        return trees.get(requireQed());
    }

    /** The list of proof trees, in first-seen order. */
    public List<ProofTree> trees() {
        return Collections.unmodifiableList(trees);
    }

    /** The uncompressed strings for each proof tree, as copies. */
    public List<byte[]> exprs() {
        List<byte[]> copies = new ArrayList<>(exprs.size());
        for (byte[] expr : exprs) {
            copies.add(expr.clone());
        }
        return Collections.unmodifiableList(copies);
    }

    public ProofTree get(int pos) {
        return trees.get(pos);
    }

    public byte[] expr(int pos) {
        return exprs.get(pos).clone();
    }

    public String exprString(int pos) {
        return ExprCodec.toDisplayString(exprs.get(pos));
    }

    /**
     * Number of times each stored step is referenced as a hypothesis of another stored
     * step. The conclusion counts one extra use. A compressor gives every step used
     * more than once a back-reference tag.
     */
    public int[] countUses() {
        int[] uses = new int[trees.size()];
        for (ProofTree tree : trees) {
            for (ProofTree child : tree.children()) {
                uses[positionOf(child)]++;
            }
        }
        if (qed >= 0) {
            uses[qed]++;
        }
        return uses;
    }

    /** Height of each step; hypotheses-free steps have height 0. */
    public int[] heights() {
        int[] heights = new int[trees.size()];
        for (int i = 0; i < trees.size(); i++) {
            int h = 0;
            for (ProofTree child : trees.get(i).children()) {
                h = Math.max(h, heights[positionOf(child)] + 1);
            }
            heights[i] = h;
        }
        return heights;
    }

    /**
     * The normal (uncompressed) proof of the conclusion: statement addresses in
     * reverse Polish order, with shared steps written out again at every use.
     */
    public List<StatementAddress> toRpn() {
        List<StatementAddress> out = new ArrayList<>();
        Deque<ProofTree> todo = new ArrayDeque<>();
        Deque<Boolean> expanded = new ArrayDeque<>();
        todo.push(trees.get(requireQed()));
        expanded.push(Boolean.FALSE);
        while (!todo.isEmpty()) {
            ProofTree tree = todo.pop();
            if (expanded.pop()) {
                out.add(tree.address());
                continue;
            }
            todo.push(tree);
            expanded.push(Boolean.TRUE);
            List<ProofTree> children = tree.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                todo.push(children.get(i));
                expanded.push(Boolean.FALSE);
            }
        }
        return out;
    }

    private int positionOf(ProofTree tree) {
        OptionalInt pos = index(tree);
        if (pos.isEmpty()) {
            throw new ProofContractException("step " + tree + " is referenced but was never built by this table");
        }
        return pos.getAsInt();
    }

    private int requireQed() {
        if (qed < 0) {
            throw new IllegalStateException("No conclusion recorded; table was not filled by fromStatement");
        }
        return qed;
    }
}
