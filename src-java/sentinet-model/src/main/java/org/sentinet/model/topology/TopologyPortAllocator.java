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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Replays host and link creation to assign port numbers.
 */
@Getter(AccessLevel.PACKAGE)
class TopologyPortAllocator {
    private final TopologyDescriptor descriptor;

    private Map<String, SwitchDescriptor> switches;
    private Map<Long, SwitchDescriptor> switchesByDpid;
    private Map<MacAddress, HostAttachment> hostsByMac;
    private List<TopologyLink> links;

    private final Map<String, Integer> nextPort = new HashMap<>();
    private final Map<String, HostDescriptor> hostsById = new HashMap<>();

    TopologyPortAllocator(TopologyDescriptor descriptor) {
        if (descriptor == null) {
            throw new TopologyException("Topology descriptor is missing");
        }
        this.descriptor = descriptor;
    }

    void allocate() {
        Map<String, SwitchDescriptor> switchIndex = new LinkedHashMap<>();
        Map<Long, SwitchDescriptor> dpidIndex = new HashMap<>();
        for (SwitchDescriptor entry : descriptor.getSwitches()) {
            if (entry == null || Strings.isNullOrEmpty(entry.getId())) {
                throw new TopologyException("Switch entry without id");
            }
            if (entry.getDpid() <= 0) {
                throw new TopologyException(String.format(
                        "Switch %s has invalid datapath id %d", entry.getId(), entry.getDpid()));
            }
            if (switchIndex.put(entry.getId(), entry) != null) {
                throw new TopologyException(String.format("Duplicate switch id %s", entry.getId()));
            }
            if (dpidIndex.put(entry.getDpid(), entry) != null) {
                throw new TopologyException(String.format("Duplicate datapath id %d", entry.getDpid()));
            }
            nextPort.put(entry.getId(), 1);
        }

        Map<MacAddress, HostAttachment> hostIndex = new LinkedHashMap<>();
        for (HostDescriptor host : descriptor.getHosts()) {
            if (host == null || Strings.isNullOrEmpty(host.getId()) || host.getMac() == null) {
                throw new TopologyException("Host entry without id or mac");
            }
            if (switchIndex.containsKey(host.getId())) {
                throw new TopologyException(String.format("Host id %s collides with a switch id", host.getId()));
            }
            if (!switchIndex.containsKey(host.getSwitchId())) {
                throw new TopologyException(String.format(
                        "Host %s is attached to unknown switch %s", host.getId(), host.getSwitchId()));
            }
            if (hostsById.put(host.getId(), host) != null) {
                throw new TopologyException(String.format("Duplicate host id %s", host.getId()));
            }
            HostAttachment attachment = new HostAttachment(host, host.getSwitchId(), takePort(host.getSwitchId()));
            if (hostIndex.put(host.getMac(), attachment) != null) {
                throw new TopologyException(String.format("Duplicate host mac %s", host.getMac()));
            }
        }

        ImmutableList.Builder<TopologyLink> linkList = ImmutableList.builder();
        Set<DirectedLink> seen = new HashSet<>();
        for (LinkDescriptor link : descriptor.getLinks()) {
            if (link == null) {
                throw new TopologyException("Empty link entry");
            }
            boolean fromSwitch = switchIndex.containsKey(link.getFrom());
            boolean toSwitch = switchIndex.containsKey(link.getTo());
            if (fromSwitch && toSwitch) {
                linkList.add(allocateSwitchLink(link, seen));
            } else {
                verifyHostLink(link, fromSwitch, toSwitch);
            }
        }

        switches = ImmutableMap.copyOf(switchIndex);
        switchesByDpid = ImmutableMap.copyOf(dpidIndex);
        hostsByMac = ImmutableMap.copyOf(hostIndex);
        links = linkList.build();
    }

    private TopologyLink allocateSwitchLink(LinkDescriptor link, Set<DirectedLink> seen) {
        if (link.getFrom().equals(link.getTo())) {
            throw new TopologyException(String.format("Self loop link on switch %s", link.getFrom()));
        }
        DirectedLink direction = new DirectedLink(link.getFrom(), link.getTo());
        if (!seen.add(direction) || !seen.add(direction.reverse())) {
            throw new TopologyException(String.format("Duplicate link %s", direction));
        }
        if (link.getBandwidthMbps() <= 0) {
            throw new TopologyException(String.format(
                    "Link %s has non positive bandwidth %s", direction, link.getBandwidthMbps()));
        }
        if (link.getDelayMs() < 0) {
            throw new TopologyException(String.format("Link %s has negative delay %s", direction, link.getDelayMs()));
        }

        int fromPort = takePort(link.getFrom());
        int toPort = takePort(link.getTo());
        return TopologyLink.builder()
                .fromSwitch(link.getFrom())
                .toSwitch(link.getTo())
                .bandwidthMbps(link.getBandwidthMbps())
                .delayMs(link.getDelayMs())
                .fromPort(fromPort)
                .toPort(toPort)
                .build();
    }

    private void verifyHostLink(LinkDescriptor link, boolean fromSwitch, boolean toSwitch) {
        HostDescriptor host;
        String switchId;
        if (fromSwitch) {
            host = hostsById.get(link.getTo());
            switchId = link.getFrom();
        } else if (toSwitch) {
            host = hostsById.get(link.getFrom());
            switchId = link.getTo();
        } else {
            throw new TopologyException(String.format(
                    "Link %s-%s does not reference any known switch", link.getFrom(), link.getTo()));
        }

        if (host == null) {
            throw new TopologyException(String.format(
                    "Link %s-%s references an unknown node", link.getFrom(), link.getTo()));
        }
        if (!switchId.equals(host.getSwitchId())) {
            throw new TopologyException(String.format(
                    "Link %s-%s contradicts host %s attachment to %s",
                    link.getFrom(), link.getTo(), host.getId(), host.getSwitchId()));
        }
    }

    private int takePort(String switchId) {
        int port = nextPort.get(switchId);
        nextPort.put(switchId, port + 1);
        return port;
    }
}
