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

package org.sentinet.navigator.model;

import org.sentinet.model.topology.DirectedLink;

import com.google.common.annotations.VisibleForTesting;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Congestion aware adjacency of the switches. Iteration order follows declaration order so tie breaks are stable.
 */
@Slf4j
@ToString
public class RoutingGraph {
    @VisibleForTesting
    final Map<String, Node> switches = new LinkedHashMap<>();

    public Node getSwitch(String switchId) {
        return switches.get(switchId);
    }

    public Node getOrAddNode(String switchId) {
        return switches.computeIfAbsent(switchId, Node::new);
    }

    public boolean contains(String switchId) {
        return switches.containsKey(switchId);
    }

    public Collection<Node> getNodes() {
        return Collections.unmodifiableCollection(switches.values());
    }

    public int size() {
        return switches.size();
    }

    /**
     * Add an edge. It must reference nodes which are already added to the graph.
     *
     * @param edge the edge to add.
     * @throws IllegalArgumentException in case of duplicate or improperly created edge.
     */
    public void addEdge(Edge edge) {
        Node source = switches.get(edge.getSrcSwitch());
        Node dest = switches.get(edge.getDestSwitch());
        if (source == null || dest == null) {
            throw new IllegalArgumentException("The edge must reference nodes already added to the graph: " + edge);
        }
        if (source.getEdgeTo(edge.getDestSwitch()) != null) {
            throw new IllegalArgumentException("Duplicate edge has been passed to RoutingGraph: " + edge);
        }
        source.addOutgoing(edge);
    }

    public Edge getEdge(String from, String to) {
        Node node = switches.get(from);
        return node == null ? null : node.getEdgeTo(to);
    }

    public Edge getEdge(DirectedLink link) {
        return getEdge(link.getFrom(), link.getTo());
    }

    /**
     * All directed edges, grouped by source switch.
     */
    public List<Edge> getEdges() {
        List<Edge> result = new ArrayList<>();
        for (Node node : switches.values()) {
            result.addAll(node.getOutgoing());
        }
        return result;
    }
}
