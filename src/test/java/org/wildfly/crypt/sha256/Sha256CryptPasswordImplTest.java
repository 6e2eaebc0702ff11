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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.security.spec.InvalidKeySpecException;
import java.util.Arrays;
import java.util.Collections;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Tests of the SHA256-CRYPT password, including the reference vectors published with Drepper's
 * "Unix crypt using SHA-256 and SHA-512".
 */
class Sha256CryptPasswordImplTest {

    static Stream<Arguments> referenceVectors() {
        return Stream.of(
            Arguments.of(5000, "saltstring", "Hello world!",
                "$5$saltstring$5B8vYYiY.CVt1RlTTf8KbXBH3hsxY/GNooZaBBGWEc5"),
            Arguments.of(10000, "saltstringsaltstring", "Hello world!",
                "$5$rounds=10000$saltstringsaltst$3xv.VbSHBb41AL9AvLeujZkZRBAwqFMz2.opqey6IcA"),
            Arguments.of(5000, "toolongsaltstring", "This is just a test",
                "$5$toolongsaltstrin$Un/5jzAHMgOGZ5.mWJpuVolil07guHPvOW8mGRcvxa5"),
            Arguments.of(77777, "short", "we have a short salt string but not a short password",
                "$5$rounds=77777$short$JiO1O3ZpDAxGJeaDIuqCoEFysAe1mZNJRs3pw0KQRd/"),
            Arguments.of(123456, "asaltof16chars..", "a short string",
                "$5$rounds=123456$asaltof16chars..$gP3VQ/6X7UUEW3HkBn2w1/Ptq2jxPyzV/cZKmF/wJvD"),
            Arguments.of(10, "roundstoolow", "the minimum number is still observed",
                "$5$rounds=1000$roundstoolow$yfvwcWrQ8l/K0DAWyuPMDNHpIVlTQebY9l/gL972bIC")
        );
    }

    @ParameterizedTest
    @MethodSource("referenceVectors")
    void cryptMatchesReferenceVector(final int rounds, final String salt, final String password, final String expected) {
        final String actual = new Sha256CryptDefinition()
                .withOptions(Collections.singletonMap(Sha256Crypt.ROUNDS, rounds))
                .defaultCrypter()
                .withSalt(ascii(salt))
                .crypt(ascii(password))
                .toString();
        assertEquals(expected, actual);
    }

    @ParameterizedTest
    @MethodSource("referenceVectors")
    void parsedReferenceVectorVerifies(final int rounds, final String salt, final String password, final String expected) throws InvalidKeySpecException {
        final Sha256CryptPasswordImpl parsed = Sha256CryptPasswordImpl.parse(expected);
        assertTrue(parsed.verify(ascii(password)));
        assertFalse(parsed.verify(ascii(password + "x")));
        assertEquals(expected, parsed.toString());
    }

    @Test
    void explicitDefaultRoundsAreElided() throws InvalidKeySpecException {
        final Sha256CryptPasswordImpl parsed = Sha256CryptPasswordImpl.parse("$5$rounds=5000$toolongsaltstrin$Un/5jzAHMgOGZ5.mWJpuVolil07guHPvOW8mGRcvxa5");
        assertEquals(Sha256Crypt.DEFAULT_ROUNDS, parsed.getRounds());
        assertEquals("$5$toolongsaltstrin$Un/5jzAHMgOGZ5.mWJpuVolil07guHPvOW8mGRcvxa5", parsed.toString());
        assertEquals(parsed, Sha256CryptPasswordImpl.parse(parsed.toString()));
    }

    @Test
    void cryptIsDeterministic() {
        final Sha256CryptPasswordImpl template = new Sha256CryptPasswordImpl(1000).withSalt(ascii("pepper"));
        final Sha256CryptPasswordImpl first = template.crypt(ascii("secret"));
        final Sha256CryptPasswordImpl second = template.crypt(ascii("secret"));
        assertEquals(first, second);
        assertEquals(Sha256Crypt.ENCODED_DIGEST_LENGTH, first.getDigest().length);
    }

    @Test
    void cryptDoesNotMutateReceiver() {
        final Sha256CryptPasswordImpl template = new Sha256CryptPasswordImpl(1000).withSalt(ascii("pepper"));
        final Sha256CryptPasswordImpl hashed = template.crypt(ascii("secret"));
        assertNotSame(template, hashed);
        assertEquals(0, template.getDigest().length);
        assertEquals("$5$rounds=1000$pepper$", template.toString());
    }

    @Test
    void randomSaltRoundTrip() throws InvalidKeySpecException {
        final Sha256CryptPasswordImpl hashed = new Sha256CryptPasswordImpl(1000).withSalt(null).crypt(ascii("correct horse"));
        assertEquals(Sha256Crypt.MAX_SALT_LENGTH, hashed.getSalt().length);
        assertTrue(hashed.verify(ascii("correct horse")));
        assertFalse(hashed.verify(ascii("correct horsE")));
        assertEquals(hashed, Sha256CryptPasswordImpl.parse(hashed.toString()));
    }

    @Test
    void randomSaltsDiffer() {
        final Sha256CryptPasswordImpl template = new Sha256CryptPasswordImpl(1000);
        assertNotEquals(template.withSalt(new byte[0]), template.withSalt(new byte[0]));
    }

    @Test
    void charPasswordsAreUtf8() {
        final Sha256CryptPasswordImpl template = new Sha256CryptPasswordImpl(1000).withSalt(ascii("saltstring"));
        final Sha256CryptPasswordImpl hashed = template.crypt("pässwörd".toCharArray());
        assertEquals(hashed, template.crypt("pässwörd".getBytes(StandardCharsets.UTF_8)));
        assertTrue(hashed.verify("pässwörd".toCharArray()));
        assertFalse(hashed.verify("passwort".toCharArray()));
    }

    @Test
    void emptyPasswordNeverVerifies() {
        final Sha256CryptPasswordImpl hashed = new Sha256CryptPasswordImpl(1000).withSalt(ascii("saltstring")).crypt(new byte[0]);
        assertEquals(Sha256Crypt.ENCODED_DIGEST_LENGTH, hashed.getDigest().length);
        assertFalse(hashed.verify(new byte[0]));
        assertFalse(hashed.verify((byte[]) null));
        assertFalse(hashed.verify(new char[0]));
    }

    @Test
    void saltIsTruncated() {
        final Sha256CryptPasswordImpl salted = new Sha256CryptPasswordImpl(1000).withSalt(ascii("0123456789abcdefXYZ"));
        assertArrayEquals(ascii("0123456789abcdef"), salted.getSalt());
    }

    @Test
    void saltStopsAtDollar() throws InvalidKeySpecException {
        final Sha256CryptPasswordImpl hashed = new Sha256CryptPasswordImpl(Sha256Crypt.DEFAULT_ROUNDS).withSalt(ascii("a$b")).crypt(ascii("secret"));
        assertArrayEquals(ascii("a"), hashed.getSalt());
        final Sha256CryptPasswordImpl parsed = Sha256CryptPasswordImpl.parse(hashed.toString());
        assertEquals(hashed, parsed);
        assertTrue(parsed.verify(ascii("secret")));
    }

    @Test
    void leadingDollarLeavesEmptySalt() {
        assertEquals(0, new Sha256CryptPasswordImpl(1000).withSalt(ascii("$abc")).getSalt().length);
    }

    @Test
    void saltLookingLikeRoundsRoundTrips() throws InvalidKeySpecException {
        final Sha256CryptPasswordImpl hashed = new Sha256CryptPasswordImpl(Sha256Crypt.DEFAULT_ROUNDS).withSalt(ascii("rounds=2000")).crypt(ascii("secret"));
        assertTrue(hashed.toString().startsWith("$5$rounds=5000$rounds=2000$"));
        final Sha256CryptPasswordImpl parsed = Sha256CryptPasswordImpl.parse(hashed.toString());
        assertEquals(hashed, parsed);
        assertEquals(Sha256Crypt.DEFAULT_ROUNDS, parsed.getRounds());
        assertTrue(parsed.verify(ascii("secret")));
    }

    @Test
    void withSaltKeepsDigest() {
        final Sha256CryptPasswordImpl hashed = new Sha256CryptPasswordImpl(1000).withSalt(ascii("one")).crypt(ascii("secret"));
        final Sha256CryptPasswordImpl resalted = hashed.withSalt(ascii("two"));
        assertArrayEquals(hashed.getDigest(), resalted.getDigest());
        assertFalse(resalted.verify(ascii("secret")));
    }

    @Test
    void withDigestTruncatesAndClears() {
        final Sha256CryptPasswordImpl template = new Sha256CryptPasswordImpl(1000);
        final byte[] longDigest = new byte[50];
        Arrays.fill(longDigest, (byte) 'a');
        assertEquals(Sha256Crypt.ENCODED_DIGEST_LENGTH, template.withDigest(longDigest).getDigest().length);
        assertEquals(0, template.withDigest(longDigest).withDigest(null).getDigest().length);
    }

    @Test
    void parseBarePrefix() throws InvalidKeySpecException {
        final Sha256CryptPasswordImpl parsed = Sha256CryptPasswordImpl.parse("$5$");
        assertEquals(Sha256Crypt.DEFAULT_ROUNDS, parsed.getRounds());
        assertEquals(0, parsed.getSalt().length);
        assertEquals(0, parsed.getDigest().length);
        assertEquals(parsed, Sha256CryptPasswordImpl.parse(parsed.toString()));
    }

    @Test
    void parseTrailingDollarMeansNoDigest() throws InvalidKeySpecException {
        final Sha256CryptPasswordImpl parsed = Sha256CryptPasswordImpl.parse("$5$rounds=20000$saltstring$");
        assertEquals(20000, parsed.getRounds());
        assertArrayEquals(ascii("saltstring"), parsed.getSalt());
        assertEquals(0, parsed.getDigest().length);
        assertEquals("$5$rounds=20000$saltstring$", parsed.toString());
    }

    @Test
    void parseRoundsOnly() throws InvalidKeySpecException {
        final Sha256CryptPasswordImpl parsed = Sha256CryptPasswordImpl.parse("$5$rounds=7000");
        assertEquals(7000, parsed.getRounds());
        assertEquals(0, parsed.getSalt().length);
    }

    @Test
    void parseSaltOnly() throws InvalidKeySpecException {
        final Sha256CryptPasswordImpl parsed = Sha256CryptPasswordImpl.parse("$5$saltstring");
        assertEquals(Sha256Crypt.DEFAULT_ROUNDS, parsed.getRounds());
        assertArrayEquals(ascii("saltstring"), parsed.getSalt());
        assertEquals(0, parsed.getDigest().length);
    }

    @Test
    void parseClampsRounds() throws InvalidKeySpecException {
        assertEquals(Sha256Crypt.MIN_ROUNDS, Sha256CryptPasswordImpl.parse("$5$rounds=1$salt$").getRounds());
        assertEquals(Sha256Crypt.MAX_ROUNDS, Sha256CryptPasswordImpl.parse("$5$rounds=999999999$salt$").getRounds());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "$6$saltstring$digest",
        "5$saltstring$digest",
        "",
        "$5",
        "$5$rounds=$salt$digest",
        "$5$rounds=12a4$salt$digest",
        "$5$rounds=-5000$salt$digest",
        "$5$rounds=1234567890$salt$digest",
        "$5$salt$digest$extra",
        "$5$rounds=10000$salt$digest$extra",
    })
    void parseRejectsMalformed(final String encoded) {
        assertThrows(InvalidKeySpecException.class, () -> Sha256CryptPasswordImpl.parse(encoded));
    }

    @Test
    void recordReportsDefinition() {
        final Sha256CryptPasswordImpl template = new Sha256CryptPasswordImpl(12345);
        assertEquals(new Sha256CryptDefinition().withOptions(Collections.singletonMap(Sha256Crypt.ROUNDS, 12345)), template.getDefinition());
        assertEquals(12345, template.getOptions().get(Sha256Crypt.ROUNDS));
    }

    @Test
    void encodedFormIsFormattedString() {
        final Sha256CryptPasswordImpl hashed = new Sha256CryptPasswordImpl(1000).withSalt(ascii("saltstring")).crypt(ascii("secret"));
        assertArrayEquals(ascii(hashed.toString()), hashed.getEncoded());
    }

    @Test
    void encodedFormKeepsSaltBytes() {
        final Sha256CryptPasswordImpl salted = new Sha256CryptPasswordImpl(1000).withSalt(new byte[] { 's', (byte) 0xe9 });
        final byte[] encoded = salted.getEncoded();
        assertArrayEquals(salted.toString().getBytes(StandardCharsets.ISO_8859_1), encoded);
        assertEquals((byte) 0xe9, encoded[encoded.length - 2]);
    }

    private static byte[] ascii(final String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }
}
