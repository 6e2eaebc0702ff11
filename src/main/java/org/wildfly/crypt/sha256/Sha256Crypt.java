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

/**
 * Constants for the SHA256-CRYPT scheme.
 */
public final class Sha256Crypt {

    private Sha256Crypt() {
    }

    /**
     * The algorithm name under which the scheme is registered.
     */
    public static final String ALGORITHM_SHA256_CRYPT = "SHA256-CRYPT";

    /**
     * The prefix which identifies an encoded SHA256-CRYPT password.
     */
    public static final String PREFIX = "$5$";

    /**
     * The option key of the rounds (cost) parameter.
     */
    public static final String ROUNDS = "rounds";

    public static final int MIN_ROUNDS = 1000;
    public static final int MAX_ROUNDS = 999_999_999;
    public static final int DEFAULT_ROUNDS = 5000;

    public static final int MAX_SALT_LENGTH = 16;
    public static final int DIGEST_LENGTH = 32;
    public static final int ENCODED_DIGEST_LENGTH = 43;

    static final String DIGEST_ALGORITHM = "SHA-256";
    static final String ROUNDS_PREFIX = ROUNDS + "=";
    static final int MAX_ROUNDS_DIGITS = 9;
}
