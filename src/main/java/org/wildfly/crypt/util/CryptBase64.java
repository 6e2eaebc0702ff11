/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2014 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
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
 */

package org.wildfly.crypt.util;

import java.nio.charset.StandardCharsets;
import java.util.Random;

/**
 * The "h64" encoding used by crypt(3): a base64 variant over the alphabet {@code ./0-9A-Za-z} which packs each
 * group of three bytes little-endian, least significant six bits first.  There is no padding.
 */
public final class CryptBase64 {

    private static final byte[] ALPHABET = "./0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz".getBytes(StandardCharsets.US_ASCII);

    private CryptBase64() {
    }

    /**
     * Get the number of characters produced for {@code length} input bytes.
     *
     * @param length the input length
     * @return the encoded length
     */
    public static int encodedLength(final int length) {
        return (length * 8 + 5) / 6;
    }

    /**
     * Encode the given bytes.  Consecutive triplets {@code (b0, b1, b2)} form the 24-bit word
     * {@code b0 | b1 << 8 | b2 << 16}, which is emitted as four characters.  A trailing pair yields three
     * characters and a trailing single byte two.
     *
     * @param bytes the bytes to encode
     * @return the encoded characters, as ASCII bytes
     */
    public static byte[] encode(final byte[] bytes) {
        final byte[] target = new byte[encodedLength(bytes.length)];
        int t = 0;
        int i = 0;
        while (i < bytes.length) {
            final int remaining = bytes.length - i;
            int w = bytes[i++] & 0xff;
            if (remaining > 1) {
                w |= (bytes[i++] & 0xff) << 8;
            }
            if (remaining > 2) {
                w |= (bytes[i++] & 0xff) << 16;
            }
            final int chars = Math.min(remaining, 3) + 1;
            for (int c = 0; c < chars; c ++) {
                target[t++] = ALPHABET[w & 0x3f];
                w >>>= 6;
            }
        }
        return target;
    }

    /**
     * Generate {@code length} random characters of the encoding alphabet, suitable as a salt.
     *
     * @param random the random source
     * @param length the number of characters
     * @return the characters, as ASCII bytes
     */
    public static byte[] randomChars(final Random random, final int length) {
        final byte[] chars = new byte[length];
        for (int i = 0; i < length; i ++) {
            chars[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return chars;
    }
}
