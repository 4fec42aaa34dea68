/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.gametime.adapter.outbound.ledger;

import me.golemcore.gametime.domain.model.LedgerException;
import me.golemcore.gametime.domain.model.LedgerFailureKind;

import java.util.Arrays;

/**
 * Signed variable-length integer codec for ledger values.
 *
 * <p>
 * Zig-zag maps the signed value onto an unsigned one (0, -1, 1, -2, ... become
 * 0, 1, 2, 3, ...), which is then written seven bits at a time, least
 * significant group first, with the high bit set on every byte but the last.
 * The byte layout matches Go's {@code binary.PutVarint}, so ledgers written by
 * the previous bot decode unchanged, including their zero padding to
 * {@value #MAX_LENGTH} bytes.
 */
public final class SignedVarintCodec {

    /**
     * Longest encoding of a 64-bit value.
     */
    public static final int MAX_LENGTH = 10;

    private static final int CONTINUATION_BIT = 0x80;
    private static final int PAYLOAD_MASK = 0x7f;

    private SignedVarintCodec() {
    }

    public static byte[] encode(long value) {
        long zigzag = (value << 1) ^ (value >> 63);
        byte[] buffer = new byte[MAX_LENGTH];
        int length = 0;
        while ((zigzag & ~PAYLOAD_MASK) != 0) {
            buffer[length++] = (byte) ((zigzag & PAYLOAD_MASK) | CONTINUATION_BIT);
            zigzag >>>= 7;
        }
        buffer[length++] = (byte) zigzag;
        return Arrays.copyOf(buffer, length);
    }

    /**
     * Decode the varint at the start of {@code bytes}. Bytes after the
     * terminating group are ignored.
     *
     * @throws LedgerException
     *             of kind {@link LedgerFailureKind#DECODE_CORRUPTION} when the
     *             buffer is empty, ends mid-value, or overflows 64 bits
     */
    public static long decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw corruption("empty value");
        }
        long zigzag = 0;
        int shift = 0;
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xff;
            if (i == MAX_LENGTH) {
                throw corruption("value longer than " + MAX_LENGTH + " bytes");
            }
            if (b < CONTINUATION_BIT) {
                if (i == MAX_LENGTH - 1 && b > 1) {
                    throw corruption("value overflows 64 bits");
                }
                zigzag |= (long) b << shift;
                return (zigzag >>> 1) ^ -(zigzag & 1);
            }
            zigzag |= (long) (b & PAYLOAD_MASK) << shift;
            shift += 7;
        }
        throw corruption("truncated value of " + bytes.length + " bytes");
    }

    private static LedgerException corruption(String detail) {
        return new LedgerException(LedgerFailureKind.DECODE_CORRUPTION, "Corrupt ledger value: " + detail);
    }
}
