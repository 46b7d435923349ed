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

package org.sentinet.controller.security;

import org.sentinet.model.MacAddress;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Notification about a detected and blocked attack.
 */
@Value
@Builder
public class SecurityAlert {
    public static final String ACTION_BLOCKED = "BLOCKED";

    @JsonProperty("attacker")
    MacAddress attacker;

    @JsonProperty("target")
    MacAddress target;

    @JsonProperty("attack_type")
    String attackType;

    @JsonProperty("confidence")
    double confidence;

    @JsonProperty("pps")
    double pps;

    @JsonProperty("bps")
    double bps;

    @JsonProperty("action_taken")
    String actionTaken;

    @JsonProperty("block_duration_sec")
    int blockDurationSec;

    @JsonProperty("timestamp")
    long timestamp;
}
