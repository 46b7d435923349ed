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
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.io.Serializable;
import java.util.List;

/**
 * Static network description: switches, hosts and links in declaration order.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class TopologyDescriptor implements Serializable {
    private static final long serialVersionUID = 1L;

    @JsonProperty("switches")
    List<SwitchDescriptor> switches;

    @JsonProperty("hosts")
    List<HostDescriptor> hosts;

    @JsonProperty("links")
    List<LinkDescriptor> links;

    @Builder
    @JsonCreator
    public TopologyDescriptor(@JsonProperty("switches") @Singular("addSwitch") List<SwitchDescriptor> switches,
                              @JsonProperty("hosts") @Singular("addHost") List<HostDescriptor> hosts,
                              @JsonProperty("links") @Singular("addLink") List<LinkDescriptor> links) {
        this.switches = switches == null ? ImmutableList.of() : ImmutableList.copyOf(switches);
        this.hosts = hosts == null ? ImmutableList.of() : ImmutableList.copyOf(hosts);
        this.links = links == null ? ImmutableList.of() : ImmutableList.copyOf(links);
    }
}
