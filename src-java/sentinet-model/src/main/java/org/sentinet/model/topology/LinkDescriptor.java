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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.io.Serializable;

/**
 * Link as it is declared. Either end may name a host, in which case the link only confirms the host attachment.
 */
@Value
public class LinkDescriptor implements Serializable {
    private static final long serialVersionUID = 1L;

    @JsonProperty("from")
    String from;

    @JsonProperty("to")
    String to;

    @JsonProperty("bw_mbps")
    double bandwidthMbps;

    @JsonProperty("delay_ms")
    double delayMs;

    @Builder
    @JsonCreator
    public LinkDescriptor(@JsonProperty("from") String from,
                          @JsonProperty("to") String to,
                          @JsonProperty("bw_mbps") Double bandwidthMbps,
                          @JsonProperty("delay_ms") Double delayMs) {
        this.from = from;
        this.to = to;
        this.bandwidthMbps = bandwidthMbps != null ? bandwidthMbps : 100;
        this.delayMs = delayMs != null ? delayMs : 1;
    }
}
