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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * Persistent form of the learned state.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class QTableSnapshot {
    @JsonProperty("q_table")
    Map<String, Map<String, Double>> values;

    @JsonProperty("epsilon")
    double epsilon;

    @JsonProperty("total_updates")
    long totalUpdates;

    @JsonProperty("paths_calculated")
    long pathsCalculated;

    @Builder
    @JsonCreator
    public QTableSnapshot(@JsonProperty("q_table") Map<String, Map<String, Double>> values,
                          @JsonProperty("epsilon") double epsilon,
                          @JsonProperty("total_updates") long totalUpdates,
                          @JsonProperty("paths_calculated") long pathsCalculated) {
        this.values = values == null ? Collections.emptyMap() : values;
        this.epsilon = epsilon;
        this.totalUpdates = totalUpdates;
        this.pathsCalculated = pathsCalculated;
    }
}
