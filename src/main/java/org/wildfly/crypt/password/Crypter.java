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

package org.wildfly.crypt.password;

import java.util.Map;

/**
 * A salted, possibly hashed, crypt password.  Crypters are immutable: every {@code with} or {@code crypt}
 * method returns a new instance and leaves the receiver untouched, so a single instance may be shared freely.
 * The {@link Object#toString() toString()} method renders the encoded form.
 */
public interface Crypter {

    /**
     * Get the definition carrying this crypter's options.
     *
     * @return the definition
     */
    Definition getDefinition();

    Map<String, Object> getOptions();

    /**
     * Get a copy of this crypter with the given salt.  The salt is cut at the first {@code $} and at the
     * scheme's maximum length.  The digest is kept as is.
     *
     * @param salt the salt, or {@code null} or empty to generate a random one
     * @return the new crypter
     */
    Crypter withSalt(byte[] salt);

    /**
     * Get a copy of this crypter with the given encoded digest.
     *
     * @param digest the encoded digest, or {@code null} or empty for none
     * @return the new crypter
     */
    Crypter withDigest(byte[] digest);

    /**
     * Hash the password with this crypter's salt and options.
     *
     * @param password the password
     * @return a new crypter carrying the digest
     */
    Crypter crypt(byte[] password);

    /**
     * Hash the UTF-8 encoding of the password.
     *
     * @param password the password
     * @return a new crypter carrying the digest
     */
    Crypter crypt(char[] password);

    /**
     * Verify a password guess against the stored digest in constant time.  An empty guess never matches.
     *
     * @param guess the password guess
     * @return {@code true} if the guess matches
     */
    boolean verify(byte[] guess);

    /**
     * Verify the UTF-8 encoding of a password guess.
     *
     * @param guess the password guess
     * @return {@code true} if the guess matches
     */
    boolean verify(char[] guess);

    /**
     * Get the encoded form as ISO-8859-1 bytes, one byte per character.
     *
     * @return the encoded form
     */
    byte[] getEncoded();
}
