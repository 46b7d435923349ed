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

package org.sentinet.model.topology;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;

/**
 * Switch to switch link with the ports derived for both of its ends.
 */
@Value
@Builder
public class TopologyLink implements Serializable {
    private static final long serialVersionUID = 1L;

    String fromSwitch;
    String toSwitch;
    double bandwidthMbps;
    double delayMs;
    int fromPort;
    int toPort;

    public DirectedLink forward() {
        return new DirectedLink(fromSwitch, toSwitch);
    }

    public DirectedLink reverse() {
        return new DirectedLink(toSwitch, fromSwitch);
    }
}
