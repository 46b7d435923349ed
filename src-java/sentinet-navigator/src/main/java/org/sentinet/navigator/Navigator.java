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

import org.sentinet.model.MacAddress;
import org.sentinet.model.topology.DirectedLink;
import org.sentinet.model.topology.Topology;
import org.sentinet.navigator.model.LinkInfo;
import org.sentinet.navigator.model.NavigatorStatus;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Computes switch level paths and learns from the network state.
 */
public interface Navigator {

    /**
     * Build the routing graph from the switch to switch links of the topology. Any previous state is dropped.
     */
    void initialize(Topology topology);

    boolean isInitialized();

    /**
     * Apply measured utilization (bits per second) of directed links and decay exploration.
     *
     * @param liveStats utilization of the directed links that carried measured traffic.
     */
    void updateLinkWeights(Map<DirectedLink, Double> liveStats);

    /**
     * Gets a path between source and destination switches.
     *
     * @return switch ids from source to destination inclusive, empty when no path is found.
     */
    List<String> getOptimalPath(String srcSwitch, String dstSwitch);

    /**
     * Gets a path between the switches the hosts are attached to.
     *
     * @return switch ids, empty when either host is unknown or no path is found.
     */
    default List<String> getPathForHosts(MacAddress src, MacAddress dst, Map<MacAddress, String> hostToSwitch) {
        String srcSwitch = hostToSwitch.get(src);
        String dstSwitch = hostToSwitch.get(dst);
        if (srcSwitch == null || dstSwitch == null) {
            return Collections.emptyList();
        }
        return getOptimalPath(srcSwitch, dstSwitch);
    }

    NavigatorStatus getStatus();

    List<LinkInfo> getLinkInfo();

    void save(Path target) throws IOException;

    /**
     * Restore learned state. Entries referencing unknown edges are ignored.
     */
    void load(Path source) throws IOException;
}
