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

import java.security.NoSuchAlgorithmException;
import java.security.Provider;
import java.security.spec.InvalidKeySpecException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A fixed set of crypt scheme definitions, probed in registration order when an encoded password is looked up.
 * Registries are immutable once built and may be shared between threads.
 */
public final class DefinitionRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefinitionRegistry.class);

    /**
     * The {@link Provider} service type under which definitions are registered.
     */
    public static final String SERVICE_TYPE = "CryptDefinition";

    private final List<Definition> definitions;

    DefinitionRegistry(final List<Definition> definitions) {
        this.definitions = Collections.unmodifiableList(new ArrayList<>(definitions));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build a registry from the definitions visible to {@link ServiceLoader} through the given class loader.
     *
     * @param classLoader the class loader to search
     * @return the registry
     */
    public static DefinitionRegistry load(final ClassLoader classLoader) {
        final Builder builder = builder();
        for (Definition definition : ServiceLoader.load(Definition.class, classLoader)) {
            builder.add(definition);
        }
        return builder.build();
    }

    /**
     * Build a registry from the {@value #SERVICE_TYPE} services of a security provider.
     *
     * @param provider the provider
     * @return the registry
     * @throws NoSuchAlgorithmException if a registered definition cannot be instantiated
     */
    public static DefinitionRegistry fromProvider(final Provider provider) throws NoSuchAlgorithmException {
        final Builder builder = builder();
        for (Provider.Service service : provider.getServices()) {
            if (SERVICE_TYPE.equals(service.getType())) {
                final Object instance = service.newInstance(null);
                if (! (instance instanceof Definition)) {
                    throw new NoSuchAlgorithmException("Service " + service.getAlgorithm() + " of provider " + provider.getName() + " is not a crypt definition");
                }
                builder.add((Definition) instance);
            }
        }
        return builder.build();
    }

    public List<Definition> getDefinitions() {
        return definitions;
    }

    /**
     * Get the definition registered under the given algorithm name.
     *
     * @param algorithm the algorithm name
     * @return the definition, or {@code null} if there is none
     */
    public Definition getDefinition(final String algorithm) {
        for (Definition definition : definitions) {
            if (definition.getAlgorithm().equals(algorithm)) {
                return definition;
            }
        }
        return null;
    }

    /**
     * Parse an encoded password with the first definition that recognizes its prefix.
     *
     * @param encoded the encoded password
     * @return the crypter, or {@code null} if no definition recognizes the string
     * @throws InvalidKeySpecException if the recognizing definition finds the string malformed
     */
    public Crypter find(final String encoded) throws InvalidKeySpecException {
        for (Definition definition : definitions) {
            final Crypter crypter = definition.tryParse(encoded);
            if (crypter != null) {
                return crypter;
            }
        }
        return null;
    }

    public static final class Builder {
        private final List<Definition> definitions = new ArrayList<>();

        Builder() {
        }

        /**
         * Add a definition.  Its algorithm name and prefix must not clash with one already added.
         *
         * @param definition the definition
         * @return this builder
         */
        public Builder add(final Definition definition) {
            for (Definition existing : definitions) {
                if (existing.getAlgorithm().equals(definition.getAlgorithm())) {
                    throw new IllegalArgumentException("Duplicate definition for algorithm " + definition.getAlgorithm());
                }
                if (existing.getPrefix().equals(definition.getPrefix())) {
                    throw new IllegalArgumentException("Duplicate definition for prefix " + definition.getPrefix());
                }
            }
            definitions.add(definition);
            return this;
        }

        public DefinitionRegistry build() {
            log.debug("Built crypt definition registry with {} definition(s): {}", definitions.size(), definitions);
            return new DefinitionRegistry(definitions);
        }
    }
}
