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

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.sentinet.controller.config.ValidatingConfigurationProvider;
import org.sentinet.controller.error.ConfigurationException;

import org.junit.Test;

import java.util.Properties;

public class SentinetApplicationTest {
    @Test
    public void controllerIsStartedFromConfiguration() {
        Properties properties = new Properties();
        properties.setProperty("sentinet.topology.resource", "topology-sample.json");
        properties.setProperty("sentinet.navigator.enabled", "false");

        SentinetController controller = SentinetApplication.start(new ValidatingConfigurationProvider(properties));
        try {
            assertTrue(controller.getActiveSwitches().isEmpty());
            assertFalse(controller.getBridgeStatus().isEnabled());
        } finally {
            controller.shutdown();
        }
    }

    @Test(expected = ConfigurationException.class)
    public void invalidConfigurationIsRejected() {
        Properties properties = new Properties();
        properties.setProperty("sentinet.navigator.alpha", "2");

        SentinetApplication.start(new ValidatingConfigurationProvider(properties));
    }
}
