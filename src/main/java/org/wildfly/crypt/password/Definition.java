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

import java.security.spec.InvalidKeySpecException;
import java.util.Map;

/**
 * A crypt password scheme together with its cost settings.  Definitions are immutable; changing an option
 * yields a new definition.
 */
public interface Definition {

    /**
     * Get the name of the scheme, for example {@code SHA256-CRYPT}.
     *
     * @return the algorithm name
     */
    String getAlgorithm();

    /**
     * Get the prefix which identifies strings encoded by this scheme, for example {@code $5$}.
     *
     * @return the prefix
     */
    String getPrefix();

    /**
     * Get a snapshot of the current options.
     *
     * @return the read-only option map
     */
    Map<String, Object> getOptions();

    /**
     * Get a definition with the given options applied.  Out of range values are clamped; unknown keys and values
     * of the wrong type are ignored.
     *
     * @param options the options to apply (may be {@code null})
     * @return the resulting definition, which may be this one
     */
    Definition withOptions(Map<String, ?> options);

    /**
     * Get a template crypter carrying this definition's options, an empty salt and no digest.
     *
     * @return the template crypter
     */
    Crypter defaultCrypter();

    /**
     * Hash a password and return its encoded form.
     *
     * @param password the password
     * @param salt the salt, or {@code null} or empty to generate one
     * @param options the options to apply first (may be {@code null})
     * @return the encoded password
     */
    String crypt(byte[] password, byte[] salt, Map<String, ?> options);

    /**
     * Parse an encoded password if it belongs to this scheme.
     *
     * @param encoded the encoded password
     * @return the crypter, or {@code null} if the string does not carry this scheme's prefix
     * @throws InvalidKeySpecException if the prefix matches but the string is malformed
     */
    Crypter tryParse(String encoded) throws InvalidKeySpecException;
}
