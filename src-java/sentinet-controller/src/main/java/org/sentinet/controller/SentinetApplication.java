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

package org.sentinet.controller;

import org.sentinet.controller.config.BridgeConfig;
import org.sentinet.controller.config.SentinetConfig;
import org.sentinet.controller.config.ValidatingConfigurationProvider;
import org.sentinet.controller.error.ConfigurationException;
import org.sentinet.navigator.config.NavigatorConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the controller with configuration read from {@code sentinet.properties} (or the resource named by the first
 * argument) and the {@code sentinet.*} system properties.
 */
public final class SentinetApplication {
    private static final Logger logger = LoggerFactory.getLogger(SentinetApplication.class);

    private SentinetApplication() {
    }

    /**
     * Main entry point.
     */
    public static void main(String[] args) {
        String resource = args.length > 0 ? args[0] : ValidatingConfigurationProvider.DEFAULT_RESOURCE;
        SentinetController controller;
        try {
            controller = start(ValidatingConfigurationProvider.fromResource(resource));
        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {} {}", e.getMessage(), e.getErrorDetails());
            System.exit(1);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(controller::shutdown, "sentinet-shutdown"));
    }

    static SentinetController start(ValidatingConfigurationProvider configurationProvider) {
        SentinetController controller = SentinetController.create(
                configurationProvider.getConfiguration(SentinetConfig.class),
                configurationProvider.getConfiguration(NavigatorConfig.class),
                configurationProvider.getConfiguration(BridgeConfig.class));
        controller.startUp();
        return controller;
    }
}
