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

@Value
public class SwitchDescriptor implements Serializable {
    private static final long serialVersionUID = 1L;

    @JsonProperty("id")
    String id;

    @JsonProperty("dpid")
    long dpid;

    @JsonProperty("role")
    String role;

    @Builder
    @JsonCreator
    public SwitchDescriptor(@JsonProperty("id") String id,
                            @JsonProperty("dpid") long dpid,
                            @JsonProperty("role") String role) {
        this.id = id;
        this.dpid = dpid;
        this.role = role;
    }
}
