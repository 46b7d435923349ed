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

import org.sentinet.model.MacAddress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated topology with the derived switch port layout.
 *
 * <p>Port numbers follow the order the emulated network creates interfaces in: every switch starts counting at 1,
 * hosts are attached first (in declaration order) and switch to switch links follow (in declaration order, the
 * {@code from} end before the {@code to} end). Any change to that order moves ports and misroutes traffic.
 */
public final class Topology {
    private static final Logger logger = LoggerFactory.getLogger(Topology.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Getter
    private final TopologyDescriptor descriptor;

    private final Map<String, SwitchDescriptor> switches;
    private final Map<Long, SwitchDescriptor> switchesByDpid;
    private final Map<MacAddress, HostAttachment> hostsByMac;

    @Getter
    private final List<TopologyLink> links;

    private final Map<String, Map<String, Integer>> switchPorts;
    private final Map<String, Map<Integer, String>> neighborsByPort;

    private Topology(TopologyDescriptor descriptor, TopologyPortAllocator allocator) {
        this.descriptor = descriptor;
        this.switches = allocator.getSwitches();
        this.switchesByDpid = allocator.getSwitchesByDpid();
        this.hostsByMac = allocator.getHostsByMac();
        this.links = allocator.getLinks();

        Map<String, Map<String, Integer>> ports = new HashMap<>();
        Map<String, Map<Integer, String>> neighbors = new HashMap<>();
        for (TopologyLink link : links) {
            ports.computeIfAbsent(link.getFromSwitch(), k -> new HashMap<>())
                    .put(link.getToSwitch(), link.getFromPort());
            ports.computeIfAbsent(link.getToSwitch(), k -> new HashMap<>())
                    .put(link.getFromSwitch(), link.getToPort());
            neighbors.computeIfAbsent(link.getFromSwitch(), k -> new HashMap<>())
                    .put(link.getFromPort(), link.getToSwitch());
            neighbors.computeIfAbsent(link.getToSwitch(), k -> new HashMap<>())
                    .put(link.getToPort(), link.getFromSwitch());
        }
        this.switchPorts = freeze(ports);
        this.neighborsByPort = freeze(neighbors);
    }

    /**
     * Validate the descriptor and derive its port layout.
     *
     * @throws TopologyException if the descriptor is inconsistent.
     */
    public static Topology fromDescriptor(TopologyDescriptor descriptor) {
        TopologyPortAllocator allocator = new TopologyPortAllocator(descriptor);
        allocator.allocate();
        Topology topology = new Topology(descriptor, allocator);
        logger.info("Topology loaded: {} switches, {} hosts, {} switch links",
                topology.switches.size(), topology.hostsByMac.size(), topology.links.size());
        return topology;
    }

    /**
     * Read the JSON form of the descriptor.
     */
    public static Topology load(InputStream stream) {
        try {
            return fromDescriptor(MAPPER.readValue(stream, TopologyDescriptor.class));
        } catch (JsonProcessingException e) {
            throw new TopologyException(String.format("Malformed topology descriptor: %s", e.getOriginalMessage()), e);
        } catch (IOException e) {
            throw new TopologyException("Unable to read topology descriptor", e);
        }
    }

    /**
     * Read the JSON descriptor from the classpath.
     */
    public static Topology loadResource(String resource) {
        InputStream stream = Topology.class.getClassLoader().getResourceAsStream(resource);
        if (stream == null) {
            throw new TopologyException(String.format("Topology resource \"%s\" not found", resource));
        }
        try (InputStream input = stream) {
            return load(input);
        } catch (IOException e) {
            throw new TopologyException(String.format("Unable to close topology resource \"%s\"", resource), e);
        }
    }

    public Collection<SwitchDescriptor> getSwitches() {
        return switches.values();
    }

    public Collection<HostAttachment> getHosts() {
        return hostsByMac.values();
    }

    public Optional<SwitchDescriptor> findSwitch(String switchId) {
        return Optional.ofNullable(switches.get(switchId));
    }

    public Optional<SwitchDescriptor> findSwitchByDpid(long dpid) {
        return Optional.ofNullable(switchesByDpid.get(dpid));
    }

    /**
     * Human readable id of the datapath, {@code "s<dpid>"} for datapaths the topology does not declare.
     */
    public String switchIdOf(long dpid) {
        SwitchDescriptor descriptor = switchesByDpid.get(dpid);
        return descriptor != null ? descriptor.getId() : "s" + dpid;
    }

    public Optional<HostAttachment> findHost(MacAddress mac) {
        return Optional.ofNullable(hostsByMac.get(mac));
    }

    /**
     * Lookup host by its IP address.
     */
    public Optional<HostAttachment> findHostByIp(String ip) {
        return hostsByMac.values().stream()
                .filter(entry -> ip.equals(entry.getHost().getIp()))
                .findFirst();
    }

    /**
     * Port of {@code from} that faces {@code to}.
     */
    public Optional<Integer> getPortToNeighbor(String from, String to) {
        return Optional.ofNullable(switchPorts.getOrDefault(from, ImmutableMap.of()).get(to));
    }

    /**
     * Switch connected to the given port of {@code switchId}, empty for host ports and unused ports.
     */
    public Optional<String> getNeighborByPort(String switchId, int port) {
        return Optional.ofNullable(neighborsByPort.getOrDefault(switchId, ImmutableMap.of()).get(port));
    }

    /**
     * Attachment switch of every declared host.
     */
    public Map<MacAddress, String> getHostToSwitchMap() {
        Map<MacAddress, String> result = new LinkedHashMap<>();
        for (HostAttachment entry : hostsByMac.values()) {
            result.put(entry.getMac(), entry.getSwitchId());
        }
        return result;
    }

    private static <K, V> Map<String, Map<K, V>> freeze(Map<String, Map<K, V>> target) {
        ImmutableMap.Builder<String, Map<K, V>> builder = ImmutableMap.builder();
        for (Map.Entry<String, Map<K, V>> entry : target.entrySet()) {
            builder.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
        }
        return builder.build();
    }
}
