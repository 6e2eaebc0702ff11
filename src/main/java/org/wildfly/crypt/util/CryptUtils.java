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

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Byte mixing helpers shared by the crypt(3) family of digest schemes.
 */
public final class CryptUtils {

    private static final byte[] NO_BYTES = new byte[0];

    private CryptUtils() {
    }

    /**
     * Get a fresh message digest instance for the given algorithm.  Every Java platform is required to
     * ship the algorithms used by the crypt schemes, so a missing one is reported as an illegal state.
     *
     * @param algorithm the digest algorithm name
     * @return the new message digest
     */
    public static MessageDigest getMessageDigest(final String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Message digest " + algorithm + " is not available", e);
        }
    }

    /**
     * Feed each span into the digest in order and finish it.  The digest is reset before use.
     *
     * @param messageDigest the digest to use
     * @param spans the byte spans to hash
     * @return the digest value
     */
    public static byte[] sum(final MessageDigest messageDigest, final byte[]... spans) {
        messageDigest.reset();
        for (byte[] span : spans) {
            messageDigest.update(span);
        }
        return messageDigest.digest();
    }

    /**
     * Cycle {@code bytes} until exactly {@code length} bytes are produced.  A longer source is truncated.
     *
     * @param bytes the source bytes
     * @param length the target length
     * @return the repeated bytes
     */
    public static byte[] repeat(final byte[] bytes, final int length) {
        if (length == 0) {
            return NO_BYTES;
        }
        if (bytes.length == 0) {
            throw new IllegalArgumentException("Cannot repeat an empty byte sequence");
        }
        final byte[] result = new byte[length];
        int i = 0;
        while (i < length) {
            final int cnt = Math.min(bytes.length, length - i);
            System.arraycopy(bytes, 0, result, i, cnt);
            i += cnt;
        }
        return result;
    }

    /**
     * Concatenate {@code count} copies of {@code bytes}.
     *
     * @param bytes the source bytes
     * @param count the number of copies
     * @return {@code count} spans, each referring to {@code bytes}
     */
    public static byte[][] multiply(final byte[] bytes, final int count) {
        final byte[][] spans = new byte[count][];
        for (int i = 0; i < count; i ++) {
            spans[i] = bytes;
        }
        return spans;
    }

    /**
     * Build the length dependent mixing sequence.  The bits of {@code length} are examined from the least
     * significant end; each one bit contributes {@code one}, each zero bit contributes {@code zero}, until no
     * set bits remain.
     *
     * @param length the value whose bits drive the sequence (the password length)
     * @param one the span for a set bit
     * @param zero the span for a clear bit
     * @return the spans in order
     */
    public static byte[][] mixer(final int length, final byte[] one, final byte[] zero) {
        final byte[][] spans = new byte[Integer.SIZE - Integer.numberOfLeadingZeros(length)][];
        int i = 0;
        for (int v = length; v > 0; v >>>= 1) {
            spans[i++] = (v & 1) != 0 ? one : zero;
        }
        return spans;
    }

    /**
     * Build the digest input of round {@code round}.
     *
     * @param round the zero based round number
     * @param previous the previous round's output
     * @param password the password sequence
     * @param salt the salt sequence
     * @return the spans in order
     */
    public static byte[][] dispatch(final int round, final byte[] previous, final byte[] password, final byte[] salt) {
        final boolean odd = (round & 1) != 0;
        final boolean withSalt = round % 3 != 0;
        final boolean withPassword = round % 7 != 0;
        final byte[][] spans = new byte[2 + (withSalt ? 1 : 0) + (withPassword ? 1 : 0)][];
        int i = 0;
        spans[i++] = odd ? password : previous;
        if (withSalt) {
            spans[i++] = salt;
        }
        if (withPassword) {
            spans[i++] = password;
        }
        spans[i] = odd ? previous : password;
        return spans;
    }

    /**
     * Clamp {@code value} into {@code [min, max]}.
     *
     * @param min the lower bound
     * @param value the value
     * @param max the upper bound
     * @return the bounded value
     */
    public static int bounded(final int min, final long value, final int max) {
        return (int) Math.max(min, Math.min(value, max));
    }
}
