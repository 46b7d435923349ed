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

package org.sentinet.controller.statistics;

import org.sentinet.model.topology.DirectedLink;
import org.sentinet.model.topology.Topology;
import org.sentinet.model.topology.TopologyLink;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Attributes the measured flow rates to the switch links the flows leave through.
 */
public class LinkUtilizationCalculator {
    private final Topology topology;

    public LinkUtilizationCalculator(Topology topology) {
        this.topology = topology;
    }

    /**
     * Sum the rates of flows per directed link. Flows leaving through host ports or unknown ports are not counted.
     *
     * @return bits per second of every directed link that carried at least one flow.
     */
    public Map<DirectedLink, Double> calculate(Collection<FlowRecord> records) {
        Map<DirectedLink, Double> usage = new HashMap<>();
        for (FlowRecord record : records) {
            Optional<String> neighbor = topology.getNeighborByPort(record.getSwitchId(), record.getOutPort());
            if (neighbor.isPresent()) {
                usage.merge(new DirectedLink(record.getSwitchId(), neighbor.get()), record.getBps(), Double::sum);
            }
        }
        return usage;
    }

    /**
     * Report the usage of every topology link.
     */
    public List<LinkStats> getLinkStats(Collection<FlowRecord> records) {
        Map<DirectedLink, Double> usage = calculate(records);
        List<LinkStats> result = new ArrayList<>();
        for (TopologyLink link : topology.getLinks()) {
            double bandwidth = link.getBandwidthMbps() * 1_000_000;
            double total = usage.getOrDefault(link.forward(), 0.0) + usage.getOrDefault(link.reverse(), 0.0);
            result.add(LinkStats.builder()
                    .from(link.getFromSwitch())
                    .to(link.getToSwitch())
                    .bandwidthBps(bandwidth)
                    .usageBps(total)
                    .utilizationPct(bandwidth > 0 ? total / bandwidth * 100 : 0)
                    .build());
        }
        return result;
    }
}
