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

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Directed switch to switch edge of the routing graph.
 */
@Getter
@ToString
@EqualsAndHashCode(of = {"srcSwitch", "destSwitch"})
public class Edge {
    @NonNull
    private final String srcSwitch;
    @NonNull
    private final String destSwitch;

    private final double bandwidthMbps;
    private final double delayMs;

    private double weight;
    private double currentBps;
    private double congestion;

    @Builder
    public Edge(@NonNull String srcSwitch, @NonNull String destSwitch, double bandwidthMbps, double delayMs) {
        this.srcSwitch = srcSwitch;
        this.destSwitch = destSwitch;
        this.bandwidthMbps = bandwidthMbps;
        this.delayMs = delayMs;
        this.weight = delayMs;
    }

    /**
     * Apply measured utilization: congestion is the used share of the capacity and the weight grows with it.
     */
    public void applyUtilization(double bps, double congestionPenaltyScale) {
        double capacity = bandwidthMbps * 1_000_000;
        currentBps = Math.max(0, bps);
        congestion = capacity > 0 ? Math.min(1.0, currentBps / capacity) : 0;
        weight = delayMs + congestion * congestionPenaltyScale;
    }

    /**
     * Build the opposite direction with the same static attributes.
     */
    public Edge swap() {
        return new Edge(destSwitch, srcSwitch, bandwidthMbps, delayMs);
    }
}
