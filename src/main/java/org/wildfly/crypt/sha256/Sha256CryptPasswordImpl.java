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

import static org.wildfly.crypt.sha256.Sha256Crypt.DEFAULT_ROUNDS;
import static org.wildfly.crypt.sha256.Sha256Crypt.ENCODED_DIGEST_LENGTH;
import static org.wildfly.crypt.sha256.Sha256Crypt.MAX_ROUNDS;
import static org.wildfly.crypt.sha256.Sha256Crypt.MAX_ROUNDS_DIGITS;
import static org.wildfly.crypt.sha256.Sha256Crypt.MAX_SALT_LENGTH;
import static org.wildfly.crypt.sha256.Sha256Crypt.MIN_ROUNDS;
import static org.wildfly.crypt.sha256.Sha256Crypt.PREFIX;
import static org.wildfly.crypt.sha256.Sha256Crypt.ROUNDS_PREFIX;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.security.spec.InvalidKeySpecException;
import java.util.Arrays;
import java.util.Map;

import org.wildfly.crypt.password.Crypter;
import org.wildfly.crypt.util.CryptBase64;
import org.wildfly.crypt.util.CryptUtils;

/**
 * <p>
 * Implementation of the SHA256-CRYPT ({@code $5$}) password.
 * </p>
 * <p>
 * Salt and digest are held as the raw characters of the encoded form, one byte per character, so formatting
 * and parsing are exact inverses.
 * </p>
 *
 * @author <a href="mailto:sguilhen@redhat.com">Stefan Guilhen</a>
 * @author <a href="mailto:david.lloyd@redhat.com">David M. Lloyd</a>
 */
final class Sha256CryptPasswordImpl implements Crypter {

    private static final byte[] NO_BYTES = new byte[0];
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final int rounds;
    private final byte[] salt;
    private final byte[] digest;

    Sha256CryptPasswordImpl(final int rounds, final byte[] salt, final byte[] digest) {
        this.rounds = rounds;
        this.salt = salt;
        this.digest = digest;
    }

    Sha256CryptPasswordImpl(final int rounds) {
        this(rounds, NO_BYTES, NO_BYTES);
    }

    public int getRounds() {
        return rounds;
    }

    public byte[] getSalt() {
        return salt.clone();
    }

    public byte[] getDigest() {
        return digest.clone();
    }

    @Override
    public Sha256CryptDefinition getDefinition() {
        return new Sha256CryptDefinition(rounds);
    }

    @Override
    public Map<String, Object> getOptions() {
        return getDefinition().getOptions();
    }

    @Override
    public Sha256CryptPasswordImpl withSalt(final byte[] salt) {
        if (salt == null || salt.length == 0) {
            return new Sha256CryptPasswordImpl(rounds, CryptBase64.randomChars(SECURE_RANDOM, MAX_SALT_LENGTH), digest);
        }
        // the salt ends at the first '$'
        int length = Math.min(salt.length, MAX_SALT_LENGTH);
        for (int i = 0; i < length; i ++) {
            if (salt[i] == '$') {
                length = i;
                break;
            }
        }
        return new Sha256CryptPasswordImpl(rounds, Arrays.copyOf(salt, length), digest);
    }

    @Override
    public Sha256CryptPasswordImpl withDigest(final byte[] digest) {
        if (digest == null || digest.length == 0) {
            return new Sha256CryptPasswordImpl(rounds, salt, NO_BYTES);
        }
        return new Sha256CryptPasswordImpl(rounds, salt, Arrays.copyOf(digest, Math.min(digest.length, ENCODED_DIGEST_LENGTH)));
    }

    @Override
    public Sha256CryptPasswordImpl crypt(final byte[] password) {
        return new Sha256CryptPasswordImpl(rounds, salt, encodedDigest(password));
    }

    @Override
    public Sha256CryptPasswordImpl crypt(final char[] password) {
        final byte[] bytes = toBytes(password);
        try {
            return crypt(bytes);
        } finally {
            Arrays.fill(bytes, (byte) 0);
        }
    }

    @Override
    public boolean verify(final byte[] guess) {
        if (guess == null || guess.length == 0) {
            return false;
        }
        return MessageDigest.isEqual(encodedDigest(guess), digest);
    }

    @Override
    public boolean verify(final char[] guess) {
        if (guess == null || guess.length == 0) {
            return false;
        }
        final byte[] bytes = toBytes(guess);
        try {
            return verify(bytes);
        } finally {
            Arrays.fill(bytes, (byte) 0);
        }
    }

    @Override
    public byte[] getEncoded() {
        return toString().getBytes(StandardCharsets.ISO_8859_1);
    }

    private byte[] encodedDigest(final byte[] password) {
        return CryptBase64.encode(Sha256CryptUtils.calculateDigest(password, salt, rounds));
    }

    private static byte[] toBytes(final char[] password) {
        final ByteBuffer buffer = StandardCharsets.UTF_8.encode(CharBuffer.wrap(password));
        final byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        if (buffer.hasArray()) {
            Arrays.fill(buffer.array(), (byte) 0);
        }
        return bytes;
    }

    /**
     * Parse an encoded SHA256-CRYPT password of the form {@code $5$[rounds=N$]salt$digest}.
     *
     * @param encoded the encoded password
     * @return the password
     * @throws InvalidKeySpecException if the string is not a well formed SHA256-CRYPT password
     */
    static Sha256CryptPasswordImpl parse(final String encoded) throws InvalidKeySpecException {
        if (encoded == null || ! encoded.startsWith(PREFIX)) {
            throw new InvalidKeySpecException("Password does not carry the " + PREFIX + " prefix");
        }
        final String[] fields = split(encoded.substring(PREFIX.length()));
        if (fields.length == 0) {
            return new Sha256CryptPasswordImpl(DEFAULT_ROUNDS);
        }
        final int rounds;
        final int saltIdx;
        if (fields[0].startsWith(ROUNDS_PREFIX)) {
            rounds = parseRounds(fields[0].substring(ROUNDS_PREFIX.length()));
            saltIdx = 1;
        } else {
            rounds = DEFAULT_ROUNDS;
            saltIdx = 0;
        }
        if (fields.length > saltIdx + 2) {
            throw new InvalidKeySpecException("Too many fields in password");
        }
        Sha256CryptPasswordImpl password = new Sha256CryptPasswordImpl(rounds);
        if (fields.length > saltIdx && ! fields[saltIdx].isEmpty()) {
            password = password.withSalt(fields[saltIdx].getBytes(StandardCharsets.ISO_8859_1));
        }
        if (fields.length > saltIdx + 1) {
            password = password.withDigest(fields[saltIdx + 1].getBytes(StandardCharsets.ISO_8859_1));
        }
        return password;
    }

    // split on '$', dropping a single trailing empty field
    private static String[] split(final String body) {
        if (body.isEmpty()) {
            return new String[0];
        }
        String[] fields = body.split("\\$", -1);
        if (fields[fields.length - 1].isEmpty()) {
            fields = Arrays.copyOf(fields, fields.length - 1);
        }
        return fields;
    }

    private static int parseRounds(final String value) throws InvalidKeySpecException {
        if (value.isEmpty() || value.length() > MAX_ROUNDS_DIGITS) {
            throw new InvalidKeySpecException("Invalid rounds value");
        }
        for (int i = 0; i < value.length(); i ++) {
            final char c = value.charAt(i);
            if (c < '0' || c > '9') {
                throw new InvalidKeySpecException("Invalid rounds value");
            }
        }
        return CryptUtils.bounded(MIN_ROUNDS, Integer.parseInt(value), MAX_ROUNDS);
    }

    private static boolean startsWithRoundsPrefix(final byte[] salt) {
        if (salt.length < ROUNDS_PREFIX.length()) {
            return false;
        }
        for (int i = 0; i < ROUNDS_PREFIX.length(); i ++) {
            if (salt[i] != ROUNDS_PREFIX.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    public boolean equals(final Object obj) {
        if (! (obj instanceof Sha256CryptPasswordImpl)) {
            return false;
        }
        final Sha256CryptPasswordImpl other = (Sha256CryptPasswordImpl) obj;
        return rounds == other.rounds && Arrays.equals(salt, other.salt) && Arrays.equals(digest, other.digest);
    }

    public int hashCode() {
        return (rounds * 31 + Arrays.hashCode(salt)) * 31 + Arrays.hashCode(digest);
    }

    public String toString() {
        final StringBuilder b = new StringBuilder(PREFIX.length() + 16 + MAX_SALT_LENGTH + ENCODED_DIGEST_LENGTH);
        b.append(PREFIX);
        if (rounds != DEFAULT_ROUNDS || startsWithRoundsPrefix(salt)) {
            b.append(ROUNDS_PREFIX).append(rounds).append('$');
        }
        b.append(new String(salt, StandardCharsets.ISO_8859_1));
        b.append('$');
        b.append(new String(digest, StandardCharsets.ISO_8859_1));
        return b.toString();
    }
}
