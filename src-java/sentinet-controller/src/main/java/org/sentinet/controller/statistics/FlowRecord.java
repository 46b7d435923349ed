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

import org.sentinet.model.MacAddress;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Counters and rates of a host flow on a switch, computed against the previous poll.
 */
@Value
@Builder
public class FlowRecord {
    @JsonProperty("switch_id")
    String switchId;

    @JsonProperty("dpid")
    long datapathId;

    @JsonProperty("src_mac")
    MacAddress srcMac;

    @JsonProperty("dst_mac")
    MacAddress dstMac;

    @JsonProperty("packet_count")
    long packetCount;

    @JsonProperty("byte_count")
    long byteCount;

    @JsonProperty("duration_sec")
    long durationSec;

    @JsonProperty("pps")
    double pps;

    @JsonProperty("bps")
    double bps;

    @JsonProperty("avg_pkt_size")
    double avgPktSize;

    @JsonProperty("out_port")
    int outPort;

    @JsonProperty("timestamp")
    long timestamp;

    @JsonIgnore
    public FlowKey getKey() {
        return new FlowKey(switchId, srcMac, dstMac);
    }

    /**
     * Moment the counters were read.
     */
    @JsonIgnore
    public Instant getReadTime() {
        return Instant.ofEpochMilli(timestamp);
    }
}
