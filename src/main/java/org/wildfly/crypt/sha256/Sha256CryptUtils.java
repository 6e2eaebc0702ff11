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

package org.wildfly.crypt.sha256;

import static org.wildfly.crypt.util.CryptUtils.dispatch;
import static org.wildfly.crypt.util.CryptUtils.mixer;
import static org.wildfly.crypt.util.CryptUtils.multiply;
import static org.wildfly.crypt.util.CryptUtils.repeat;
import static org.wildfly.crypt.util.CryptUtils.sum;

import java.security.MessageDigest;

import org.wildfly.crypt.util.CryptUtils;

/**
 * The SHA256-CRYPT digest algorithm, as described in Ulrich Drepper's "Unix crypt using SHA-256 and SHA-512".
 */
final class Sha256CryptUtils {

    // output position k takes byte PERMUTATION[k] of the last round
    private static final int[] PERMUTATION = {
        20, 10,  0,
        11,  1, 21,
         2, 22, 12,
        23, 13,  3,
        14,  4, 24,
         5, 25, 15,
        26, 16,  6,
        17,  7, 27,
         8, 28, 18,
        29, 19,  9,
        30, 31,
    };

    private Sha256CryptUtils() {
    }

    /**
     * Calculate the raw digest of a password.  The result is already permuted into the order in which the
     * encoder consumes it.
     *
     * @param password the password bytes
     * @param salt the salt bytes (at most 16)
     * @param rounds the number of rounds, already bounded
     * @return the 32 byte digest
     */
    static byte[] calculateDigest(final byte[] password, final byte[] salt, final int rounds) {
        final MessageDigest messageDigest = CryptUtils.getMessageDigest(Sha256Crypt.DIGEST_ALGORITHM);
        final int passwordLength = password.length;

        final byte[] sumB = sum(messageDigest, password, salt, password);

        messageDigest.reset();
        messageDigest.update(password);
        messageDigest.update(salt);
        messageDigest.update(repeat(sumB, passwordLength));
        for (byte[] span : mixer(passwordLength, sumB, password)) {
            messageDigest.update(span);
        }
        final byte[] sumA = messageDigest.digest();

        final byte[] sequenceP = repeat(sum(messageDigest, multiply(password, passwordLength)), passwordLength);
        final byte[] sequenceS = repeat(sum(messageDigest, multiply(salt, 16 + (sumA[0] & 0xff))), salt.length);

        byte[] sumC = sumA;
        for (int i = 0; i < rounds; i ++) {
            sumC = sum(messageDigest, dispatch(i, sumC, sequenceP, sequenceS));
        }

        final byte[] result = new byte[Sha256Crypt.DIGEST_LENGTH];
        for (int k = 0; k < result.length; k ++) {
            result[k] = sumC[PERMUTATION[k]];
        }
        return result;
    }
}
