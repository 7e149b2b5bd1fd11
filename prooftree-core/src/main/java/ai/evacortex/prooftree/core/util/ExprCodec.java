/*
 * ProofTree — Metamath Proof Object Core
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.prooftree.core.util;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Converts the verifier's packed math strings into their display form.
 *
 * <p>Packed form: tokens are concatenated without separators and the last byte of
 * every token carries {@link #TOKEN_END} in its high bit. Display form: one leading
 * space, tokens separated by single spaces, no trailing space. The packed string for
 * {@code |- ph} is therefore {@code '|', '-' | 0x80, 'p', 'h' | 0x80} and unpacks to
 * {@code " |- ph"}.</p>
 */
public final class ExprCodec {

    public static final int TOKEN_END = 0x80;
    private static final byte SPACE = ' ';

    private ExprCodec() {
    }

    public static byte[] unpack(byte[] packed) {
        byte[] out = new byte[packed.length * 2 + 1];
        int pos = 0;
        out[pos++] = SPACE;
        for (byte b : packed) {
            if ((b & TOKEN_END) == 0) {
                out[pos++] = b;
            } else {
                out[pos++] = (byte) (b & 0x7F);
                out[pos++] = SPACE;
            }
        }
        // drop the separator after the last token (or the lone leading space)
        return Arrays.copyOf(out, pos - 1);
    }

    public static String toDisplayString(byte[] unpacked) {
        return new String(unpacked, StandardCharsets.US_ASCII);
    }
}
