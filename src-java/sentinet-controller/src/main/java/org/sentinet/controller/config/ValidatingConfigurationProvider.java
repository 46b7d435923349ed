/* Copyright 2023 Telstra Open Source
 *
 *   Licensed under the Apache License, Version 2.0 (the "License");
 *   you may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package org.sentinet.controller.config;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toSet;

import org.sentinet.controller.error.ConfigurationException;

import com.sabre.oss.conf4j.factory.ConfigurationFactory;
import com.sabre.oss.conf4j.factory.jdkproxy.JdkProxyStaticConfigurationFactory;
import com.sabre.oss.conf4j.source.ConfigurationSource;
import com.sabre.oss.conf4j.source.PropertiesConfigurationSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.Set;
import javax.validation.ConstraintViolation;
import javax.validation.Validation;
import javax.validation.Validator;

/**
 * Creates a configuration instance, fills it with values from the source and validates it against the
 * constraints declared on the configuration interface.
 *
 * @see ConfigurationSource
 * @see ConfigurationFactory
 * @see Validator
 */
public class ValidatingConfigurationProvider {
    private static final Logger logger = LoggerFactory.getLogger(ValidatingConfigurationProvider.class);

    public static final String DEFAULT_RESOURCE = "sentinet.properties";
    private static final String SYSTEM_PROPERTY_PREFIX = "sentinet.";

    private final ConfigurationSource source;
    private final ConfigurationFactory factory;
    private final Validator validator;

    public ValidatingConfigurationProvider(Properties properties) {
        this(new PropertiesConfigurationSource(properties), new JdkProxyStaticConfigurationFactory());
    }

    public ValidatingConfigurationProvider(ConfigurationSource source, ConfigurationFactory factory) {
        this.source = source;
        this.factory = factory;

        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    /**
     * Read the given classpath resource (if it exists) and overlay the {@code sentinet.*} system properties.
     */
    public static ValidatingConfigurationProvider fromResource(String resource) {
        Properties properties = new Properties();
        try (InputStream stream = ValidatingConfigurationProvider.class.getClassLoader()
                .getResourceAsStream(resource)) {
            if (stream != null) {
                properties.load(stream);
            } else {
                logger.info("Configuration resource {} not found, using defaults", resource);
            }
        } catch (IOException e) {
            throw new ConfigurationException(format("Unable to read configuration resource %s", resource), e);
        }

        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                properties.setProperty(key, System.getProperty(key));
            }
        }
        return new ValidatingConfigurationProvider(properties);
    }

    /**
     * Creates, fills and validates a configuration instance for specified type.
     *
     * @param configurationType configuration interface.
     * @return configuration instance
     * @throws ConfigurationException if a value can't be converted or violates a constraint.
     */
    public <T> T getConfiguration(Class<T> configurationType) {
        requireNonNull(configurationType, "configurationType cannot be null");

        T instance;
        Set<ConstraintViolation<T>> errors;
        try {
            instance = factory.createConfiguration(configurationType, source);
            errors = validator.validate(instance);
        } catch (RuntimeException e) {
            throw new ConfigurationException(format("Unable to build %s: %s",
                    configurationType.getSimpleName(), e.getMessage()), e);
        }

        if (!errors.isEmpty()) {
            Set<String> errorDetails = errors.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .collect(toSet());

            throw new ConfigurationException(
                    format("The configuration value(s) for %s violate constraint(s): %s",
                            configurationType.getSimpleName(), String.join(";", errorDetails)), errorDetails);
        }
        return instance;
    }
}
