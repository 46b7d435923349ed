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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@EqualsAndHashCode(of = "switchId")
@ToString(exclude = "outgoingLinks")
public class Node {
    private final String switchId;

    private final Map<String, Edge> outgoingLinks = new LinkedHashMap<>();

    public Node(@NonNull String switchId) {
        this.switchId = switchId;
    }

    /**
     * Outgoing edges in the order the links were declared.
     */
    public Collection<Edge> getOutgoing() {
        return Collections.unmodifiableCollection(outgoingLinks.values());
    }

    public Edge getEdgeTo(String neighbor) {
        return outgoingLinks.get(neighbor);
    }

    void addOutgoing(Edge edge) {
        outgoingLinks.put(edge.getDestSwitch(), edge);
    }
}
