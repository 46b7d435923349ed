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

package org.sentinet.controller.forwarding;

import static org.sentinet.controller.utils.SwitchFlowUtils.getInPort;

import org.sentinet.controller.config.SentinetConfig;
import org.sentinet.controller.error.OfInstallException;
import org.sentinet.controller.mitigation.MitigationManager;
import org.sentinet.controller.switchmanager.SwitchManager;
import org.sentinet.controller.switchmanager.SwitchRecord;
import org.sentinet.controller.switchmanager.SwitchRegistry;
import org.sentinet.controller.utils.EthernetFrame;
import org.sentinet.model.MacAddress;
import org.sentinet.model.topology.HostAttachment;
import org.sentinet.model.topology.Topology;
import org.sentinet.navigator.Navigator;

import com.google.common.annotations.VisibleForTesting;
import org.projectfloodlight.openflow.protocol.OFPacketIn;
import org.projectfloodlight.openflow.types.OFPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * L2 learning switch logic with navigator routing for destinations not learned yet.
 */
public class ForwardingDecisionEngine {
    private static final Logger logger = LoggerFactory.getLogger(ForwardingDecisionEngine.class);

    private final SwitchRegistry switchRegistry;
    private final SwitchManager switchManager;
    private final MitigationManager mitigationManager;
    private final Navigator navigator;
    private final SentinetConfig config;

    public ForwardingDecisionEngine(SwitchRegistry switchRegistry, SwitchManager switchManager,
                                    MitigationManager mitigationManager, Navigator navigator,
                                    SentinetConfig config) {
        this.switchRegistry = switchRegistry;
        this.switchManager = switchManager;
        this.mitigationManager = mitigationManager;
        this.navigator = navigator;
        this.config = config;
    }

    /**
     * Learn the source of the frame, choose its output and push the rule and the frame to the switch.
     */
    public ForwardingDecision handlePacketIn(SwitchRecord sw, OFPacketIn packetIn) {
        Optional<EthernetFrame> parsed = EthernetFrame.parse(packetIn.getData());
        if (!parsed.isPresent()) {
            logger.debug("Ignore truncated frame from switch {}", sw.getSwitchId());
            return ForwardingDecision.ignore();
        }
        EthernetFrame frame = parsed.get();
        if (frame.isControlNoise()) {
            return ForwardingDecision.ignore();
        }

        OFPort inPort = getInPort(packetIn);
        MacAddress src = frame.getSource();
        MacAddress dst = frame.getDestination();
        switchRegistry.learnSource(sw.getSwitchId(), src, inPort.getPortNumber());

        if (mitigationManager.isBlocked(src, dst)) {
            logger.trace("Drop frame of blocked pair {} -> {} on switch {}", src, dst, sw.getSwitchId());
            return ForwardingDecision.drop();
        }

        ForwardingDecision decision = decide(sw, src, dst);
        if (decision.getAction() == ForwardingDecision.Action.OUTPUT) {
            OFPort outPort = OFPort.of(decision.getPort());
            int idleTimeout = isNavigatorActive() ? config.getNavigatorFlowIdleTimeout() : config.getFlowIdleTimeout();
            try {
                switchManager.installForwardingRule(sw.getConnection(), inPort, src, dst, outPort,
                        idleTimeout, config.getFlowHardTimeout());
            } catch (OfInstallException e) {
                logger.error("Unable to install forwarding rule {} -> {} on switch {}: {}",
                        src, dst, sw.getSwitchId(), e.getMessage());
            }
            sendPacketOut(sw, packetIn, inPort, outPort);
        } else {
            sendPacketOut(sw, packetIn, inPort, OFPort.FLOOD);
        }

        logger.debug("Switch {}: {} -> {} from port {}: {}", sw.getSwitchId(), src, dst, inPort, decision);
        return decision;
    }

    @VisibleForTesting
    ForwardingDecision decide(SwitchRecord sw, MacAddress src, MacAddress dst) {
        Optional<Integer> learned = switchRegistry.lookupPort(sw.getSwitchId(), dst);
        if (learned.isPresent()) {
            return ForwardingDecision.output(learned.get(), false);
        }

        if (!isNavigatorActive() || dst.isMulticast()) {
            return ForwardingDecision.flood();
        }

        List<String> path;
        try {
            path = navigator.getPathForHosts(src, dst, switchRegistry.getTopology().getHostToSwitchMap());
        } catch (RuntimeException e) {
            logger.error("Navigator failed on {} -> {}, flooding", src, dst, e);
            return ForwardingDecision.flood();
        }

        Optional<Integer> port = pathToPort(sw.getSwitchId(), path, dst);
        if (!port.isPresent()) {
            logger.debug("No usable path for {} -> {} on switch {}: {}", src, dst, sw.getSwitchId(), path);
            return ForwardingDecision.flood();
        }
        logger.debug("Navigator path {} for {} -> {}, using port {}", path, src, dst, port.get());
        return ForwardingDecision.output(port.get(), true);
    }

    /**
     * Port of the switch that continues the path toward the destination host.
     */
    @VisibleForTesting
    Optional<Integer> pathToPort(String switchId, List<String> path, MacAddress dst) {
        int index = path.indexOf(switchId);
        if (index < 0) {
            return Optional.empty();
        }

        Topology topology = switchRegistry.getTopology();
        if (index < path.size() - 1) {
            return topology.getPortToNeighbor(switchId, path.get(index + 1));
        }

        Optional<HostAttachment> host = topology.findHost(dst);
        if (!host.isPresent()) {
            return Optional.empty();
        }
        if (!switchId.equals(host.get().getSwitchId())) {
            logger.warn("Path for {} ends on switch {}, but the host is attached to {}",
                    dst, switchId, host.get().getSwitchId());
            return Optional.empty();
        }
        return Optional.of(host.get().getPort());
    }

    private boolean isNavigatorActive() {
        return config.isNavigatorEnabled() && navigator.isInitialized();
    }

    private void sendPacketOut(SwitchRecord sw, OFPacketIn packetIn, OFPort inPort, OFPort outPort) {
        try {
            switchManager.sendPacketOut(sw.getConnection(), packetIn, inPort, outPort);
        } catch (OfInstallException e) {
            logger.error("Unable to send packet-out to port {} of switch {}: {}",
                    outPort, sw.getSwitchId(), e.getMessage());
        }
    }
}
