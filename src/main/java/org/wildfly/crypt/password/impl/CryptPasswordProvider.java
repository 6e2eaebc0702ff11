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

package org.wildfly.crypt.password.impl;

import java.security.Provider;
import java.util.Collections;

import org.kohsuke.MetaInfServices;
import org.wildfly.crypt.password.DefinitionRegistry;
import org.wildfly.crypt.sha256.Sha256Crypt;
import org.wildfly.crypt.sha256.Sha256CryptDefinition;

/**
 * Security provider for the crypt password definitions.  Each definition is a {@value DefinitionRegistry#SERVICE_TYPE}
 * service aliased by its encoded prefix.
 *
 * @author <a href="mailto:david.lloyd@redhat.com">David M. Lloyd</a>
 */
@MetaInfServices(Provider.class)
public final class CryptPasswordProvider extends Provider {

    private static final long serialVersionUID = -2093480386417253402L;

    public CryptPasswordProvider() {
        super("WildFlyCrypt", "1.0", "WildFly Crypt Password Provider");
        putService(new Service(this, DefinitionRegistry.SERVICE_TYPE, Sha256Crypt.ALGORITHM_SHA256_CRYPT, Sha256CryptDefinition.class.getName(), Collections.singletonList(Sha256Crypt.PREFIX), Collections.<String, String>emptyMap()));
    }

}
