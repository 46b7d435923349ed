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

package org.sentinet.controller.bridge;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Operator command queued by the backend.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class PendingCommand {
    public static final String BLOCK = "block";
    public static final int DEFAULT_DURATION_SEC = 60;

    @JsonProperty("command")
    String command;

    /**
     * IP or MAC address of a topology host.
     */
    @JsonProperty("target")
    String target;

    @JsonProperty("duration")
    int durationSec;

    @JsonCreator
    public PendingCommand(@JsonProperty("command") String command,
                          @JsonProperty("target") String target,
                          @JsonProperty("duration") Integer durationSec) {
        this.command = command;
        this.target = target;
        this.durationSec = durationSec != null ? durationSec : DEFAULT_DURATION_SEC;
    }
}
