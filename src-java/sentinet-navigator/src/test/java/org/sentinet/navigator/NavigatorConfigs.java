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

package org.sentinet.navigator;

import org.sentinet.navigator.config.NavigatorConfig;

import com.sabre.oss.conf4j.factory.jdkproxy.JdkProxyStaticConfigurationFactory;
import com.sabre.oss.conf4j.source.PropertiesConfigurationSource;

import java.util.Properties;

/**
 * Navigator configuration with a few values overridden, the rest keep their defaults.
 */
public final class NavigatorConfigs {
    private static final String PREFIX = "sentinet.navigator.";

    /**
     * Build the configuration from key/value pairs, keys without the common prefix.
     */
    public static NavigatorConfig of(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs");
        }
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(PREFIX + keyValues[i], keyValues[i + 1]);
        }
        return new JdkProxyStaticConfigurationFactory()
                .createConfiguration(NavigatorConfig.class, new PropertiesConfigurationSource(properties));
    }

    /**
     * Exploitation only, no jitter: paths depend on the graph alone.
     */
    public static NavigatorConfig greedy() {
        return of("epsilon", "0", "epsilon-min", "0", "initial-jitter", "0");
    }

    private NavigatorConfigs() {
    }
}
