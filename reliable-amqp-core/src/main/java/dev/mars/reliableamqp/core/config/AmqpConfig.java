/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
package dev.mars.reliableamqp.core.config;

import dev.mars.reliableamqp.api.error.ConfigurationValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validated AMQP connection configuration read from the process environment.
 *
 * <p>The only input is {@code AMQP_CONNECTION_STRING}, which must be a URI with scheme
 * {@code amqp} or {@code amqps}. Validation reports every violation at once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public final class AmqpConfig {
    private static final Logger logger = LoggerFactory.getLogger(AmqpConfig.class);

    public static final String CONNECTION_STRING_KEY = "AMQP_CONNECTION_STRING";

    private static final Set<String> ALLOWED_SCHEMES = Set.of("amqp", "amqps");
    private static final Pattern SCHEME = Pattern.compile("^([A-Za-z][A-Za-z0-9+.-]*):");
    private static final String AUTHORITY_PREFIX = "://";
    private static final String MASK = "****";

    private final String connectionString;

    private AmqpConfig(String connectionString) {
        this.connectionString = connectionString;
    }

    /**
     * Loads the configuration from {@link System#getenv()}.
     */
    public static AmqpConfig fromSystemEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Loads the configuration from an environment map. Unknown keys are ignored.
     *
     * @throws ConfigurationValidationException listing every violation found
     */
    public static AmqpConfig fromEnvironment(Map<String, String> environment) {
        Objects.requireNonNull(environment, "Environment cannot be null");
        List<String> errors = new ArrayList<>();

        String connectionString = environment.get(CONNECTION_STRING_KEY);
        if (connectionString == null || connectionString.isEmpty()) {
            errors.add(CONNECTION_STRING_KEY + " is required");
        } else {
            validateConnectionString(connectionString, errors);
        }

        if (!errors.isEmpty()) {
            logger.error("AMQP configuration validation failed: {}", errors);
            throw new ConfigurationValidationException(errors);
        }

        logger.info("Loaded AMQP configuration for {}", redact(connectionString));
        return new AmqpConfig(connectionString);
    }

    /**
     * Validates an explicit connection string.
     *
     * @throws ConfigurationValidationException listing every violation found
     */
    public static AmqpConfig of(String connectionString) {
        Map<String, String> environment = connectionString == null
            ? Map.of()
            : Map.of(CONNECTION_STRING_KEY, connectionString);
        return fromEnvironment(environment);
    }

    private static void validateConnectionString(String value, List<String> errors) {
        try {
            new URI(value);
        } catch (URISyntaxException e) {
            errors.add(CONNECTION_STRING_KEY + " must be a valid URI: " + e.getReason());
        }

        Matcher matcher = SCHEME.matcher(value);
        if (!matcher.find()) {
            errors.add(CONNECTION_STRING_KEY + " must use scheme amqp or amqps");
        } else {
            String scheme = matcher.group(1).toLowerCase(Locale.ROOT);
            if (!ALLOWED_SCHEMES.contains(scheme)) {
                errors.add(CONNECTION_STRING_KEY + " must use scheme amqp or amqps, got: " + scheme);
            }
        }
    }

    /**
     * Masks the password part of a connection string. Everything between the first
     * {@code :} of the user info and the last {@code @} is replaced, so a password
     * is never shown even if it was not percent-encoded.
     */
    public static String redact(String connectionString) {
        if (connectionString == null) {
            return null;
        }
        int authorityStart = connectionString.indexOf(AUTHORITY_PREFIX);
        if (authorityStart < 0) {
            return connectionString;
        }
        authorityStart += AUTHORITY_PREFIX.length();

        // The host never contains '@', so the last one ends the user info even
        // when the password itself holds '@' or '/'.
        int userInfoEnd = connectionString.lastIndexOf('@');
        if (userInfoEnd < authorityStart) {
            return connectionString;
        }
        int passwordStart = connectionString.indexOf(':', authorityStart);
        if (passwordStart < 0 || passwordStart > userInfoEnd) {
            return connectionString;
        }
        return connectionString.substring(0, passwordStart + 1) + MASK + connectionString.substring(userInfoEnd);
    }

    /** Returns the connection string exactly as configured */
    public String getConnectionString() {
        return connectionString;
    }

    /** Returns the connection string with its password masked, for logs and errors */
    public String getRedactedConnectionString() {
        return redact(connectionString);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return connectionString.equals(((AmqpConfig) o).connectionString);
    }

    @Override
    public int hashCode() {
        return connectionString.hashCode();
    }

    @Override
    public String toString() {
        return "AmqpConfig{connectionString='" + getRedactedConnectionString() + "'}";
    }
}
