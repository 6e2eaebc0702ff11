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

import static org.wildfly.crypt.sha256.Sha256Crypt.ALGORITHM_SHA256_CRYPT;
import static org.wildfly.crypt.sha256.Sha256Crypt.DEFAULT_ROUNDS;
import static org.wildfly.crypt.sha256.Sha256Crypt.MAX_ROUNDS;
import static org.wildfly.crypt.sha256.Sha256Crypt.MIN_ROUNDS;
import static org.wildfly.crypt.sha256.Sha256Crypt.PREFIX;
import static org.wildfly.crypt.sha256.Sha256Crypt.ROUNDS;

import java.math.BigInteger;
import java.security.spec.InvalidKeySpecException;
import java.util.Collections;
import java.util.Map;

import org.kohsuke.MetaInfServices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wildfly.crypt.password.Crypter;
import org.wildfly.crypt.password.Definition;
import org.wildfly.crypt.util.CryptUtils;

/**
 * The SHA256-CRYPT scheme definition.  The only option is {@value Sha256Crypt#ROUNDS}, which is kept within
 * [{@value Sha256Crypt#MIN_ROUNDS}, {@value Sha256Crypt#MAX_ROUNDS}] and defaults to
 * {@value Sha256Crypt#DEFAULT_ROUNDS}.
 *
 * @author <a href="mailto:david.lloyd@redhat.com">David M. Lloyd</a>
 */
@MetaInfServices(Definition.class)
public final class Sha256CryptDefinition implements Definition {

    private static final Logger log = LoggerFactory.getLogger(Sha256CryptDefinition.class);

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private final int rounds;

    /**
     * Construct a new instance with the default number of rounds.
     */
    public Sha256CryptDefinition() {
        this(DEFAULT_ROUNDS);
    }

    Sha256CryptDefinition(final int rounds) {
        this.rounds = rounds;
    }

    public int getRounds() {
        return rounds;
    }

    public String getAlgorithm() {
        return ALGORITHM_SHA256_CRYPT;
    }

    public String getPrefix() {
        return PREFIX;
    }

    public Map<String, Object> getOptions() {
        return Collections.<String, Object>singletonMap(ROUNDS, Integer.valueOf(rounds));
    }

    public Sha256CryptDefinition withOptions(final Map<String, ?> options) {
        if (options == null) {
            return this;
        }
        final Object value = options.get(ROUNDS);
        final long requested;
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            requested = ((Number) value).longValue();
        } else if (value instanceof BigInteger) {
            requested = ((BigInteger) value).max(LONG_MIN).min(LONG_MAX).longValue();
        } else {
            if (value != null) {
                log.debug("Ignoring {} option of type {}", ROUNDS, value.getClass().getName());
            }
            return this;
        }
        final int bounded = CryptUtils.bounded(MIN_ROUNDS, requested, MAX_ROUNDS);
        if (bounded != requested) {
            log.debug("Clamped {} option from {} to {}", ROUNDS, requested, bounded);
        }
        return new Sha256CryptDefinition(bounded);
    }

    public Crypter defaultCrypter() {
        return new Sha256CryptPasswordImpl(rounds);
    }

    public String crypt(final byte[] password, final byte[] salt, final Map<String, ?> options) {
        return withOptions(options).defaultCrypter().withSalt(salt).crypt(password).toString();
    }

    public Crypter tryParse(final String encoded) throws InvalidKeySpecException {
        if (encoded == null || ! encoded.startsWith(PREFIX)) {
            return null;
        }
        return Sha256CryptPasswordImpl.parse(encoded);
    }

    public boolean equals(final Object obj) {
        return obj instanceof Sha256CryptDefinition && rounds == ((Sha256CryptDefinition) obj).rounds;
    }

    public int hashCode() {
        return rounds;
    }

    public String toString() {
        return "{" + ALGORITHM_SHA256_CRYPT + "}";
    }
}
