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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LinkInfo {
    @JsonProperty("from")
    String from;

    @JsonProperty("to")
    String to;

    @JsonProperty("weight")
    double weight;

    @JsonProperty("congestion")
    double congestion;

    @JsonProperty("current_bps")
    double currentBps;

    @JsonProperty("bandwidth_mbps")
    double bandwidthMbps;

    @JsonProperty("delay_ms")
    double delayMs;

    /**
     * Snapshot of the edge attributes.
     */
    public static LinkInfo of(Edge edge) {
        return LinkInfo.builder()
                .from(edge.getSrcSwitch())
                .to(edge.getDestSwitch())
                .weight(edge.getWeight())
                .congestion(edge.getCongestion())
                .currentBps(edge.getCurrentBps())
                .bandwidthMbps(edge.getBandwidthMbps())
                .delayMs(edge.getDelayMs())
                .build();
    }
}
