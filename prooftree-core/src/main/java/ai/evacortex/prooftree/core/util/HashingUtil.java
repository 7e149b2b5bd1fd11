/*
 * ProofTree — Metamath Proof Object Core
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.prooftree.core.util;

import ai.evacortex.prooftree.core.ProofTree;
import ai.evacortex.prooftree.core.config.ProofTreeConfig;
import ai.evacortex.prooftree.core.db.StatementAddress;
import net.jpountz.xxhash.XXHash64;
import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;
import java.util.List;

public class HashingUtil {

    private static final XXHash64 XX_HASH = XXHashFactory.fastestInstance().hash64();
    private static final int SEED = ProofTreeConfig.system().hashSeed();

    private HashingUtil() {
    }

    /**
     * Digest of a proof step: the statement address followed by the cached digest of
     * every child, in order. Children are not traversed.
     */
    public static long treeDigest(StatementAddress address, List<ProofTree> children) {
        ByteBuffer buffer = ByteBuffer.allocate(Integer.BYTES * 3 + Long.BYTES * children.size());
        buffer.putInt(address.segmentId());
        buffer.putInt(address.index());
        buffer.putInt(children.size());
        for (ProofTree child : children) {
            buffer.putLong(child.digest());
        }
        return XX_HASH.hash(buffer.array(), 0, buffer.position(), SEED);
    }
}
