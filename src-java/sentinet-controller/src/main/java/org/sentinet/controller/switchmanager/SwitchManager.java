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

package org.sentinet.controller.switchmanager;

import static org.sentinet.controller.utils.SwitchFlowUtils.DROP_COOKIE;
import static org.sentinet.controller.utils.SwitchFlowUtils.DROP_PRIORITY;
import static org.sentinet.controller.utils.SwitchFlowUtils.FORWARDING_COOKIE;
import static org.sentinet.controller.utils.SwitchFlowUtils.FORWARDING_PRIORITY;
import static org.sentinet.controller.utils.SwitchFlowUtils.TABLE_MISS_COOKIE;
import static org.sentinet.controller.utils.SwitchFlowUtils.TABLE_MISS_PRIORITY;
import static org.sentinet.controller.utils.SwitchFlowUtils.actionOutput;
import static org.sentinet.controller.utils.SwitchFlowUtils.actionSendToController;
import static org.sentinet.controller.utils.SwitchFlowUtils.applyActions;
import static org.sentinet.controller.utils.SwitchFlowUtils.matchMacPair;
import static org.sentinet.controller.utils.SwitchFlowUtils.matchPortMacPair;
import static org.sentinet.controller.utils.SwitchFlowUtils.prepareFlowModBuilder;

import org.sentinet.controller.error.OfInstallException;
import org.sentinet.model.MacAddress;

import org.projectfloodlight.openflow.protocol.OFFactory;
import org.projectfloodlight.openflow.protocol.OFFlowMod;
import org.projectfloodlight.openflow.protocol.OFFlowStatsRequest;
import org.projectfloodlight.openflow.protocol.OFMessage;
import org.projectfloodlight.openflow.protocol.OFPacketIn;
import org.projectfloodlight.openflow.protocol.OFPacketOut;
import org.projectfloodlight.openflow.types.OFBufferId;
import org.projectfloodlight.openflow.types.OFGroup;
import org.projectfloodlight.openflow.types.OFPort;
import org.projectfloodlight.openflow.types.TableId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;

/**
 * Builds and pushes the OpenFlow messages the controller sends to switches.
 */
public class SwitchManager {
    private static final Logger logger = LoggerFactory.getLogger(SwitchManager.class);

    /**
     * Installs the lowest priority rule sending every unmatched frame to the controller.
     */
    public void installTableMissRule(SwitchConnection sw) throws OfInstallException {
        OFFactory ofFactory = sw.getOFFactory();
        OFFlowMod flowMod = prepareFlowModBuilder(ofFactory, TABLE_MISS_COOKIE, TABLE_MISS_PRIORITY)
                .setMatch(ofFactory.buildMatch().build())
                .setInstructions(applyActions(ofFactory,
                        Collections.singletonList(actionSendToController(ofFactory))))
                .build();
        pushFlow(sw, "--TableMissFlow--", flowMod);
    }

    /**
     * Installs the rule forwarding frames of the (in port, source, destination) triple to the given port.
     */
    public void installForwardingRule(SwitchConnection sw, OFPort inPort, MacAddress src, MacAddress dst,
                                      OFPort outPort, int idleTimeout, int hardTimeout) throws OfInstallException {
        OFFactory ofFactory = sw.getOFFactory();
        OFFlowMod flowMod = prepareFlowModBuilder(ofFactory, FORWARDING_COOKIE, FORWARDING_PRIORITY)
                .setMatch(matchPortMacPair(ofFactory, inPort, src, dst))
                .setIdleTimeout(idleTimeout)
                .setHardTimeout(hardTimeout)
                .setInstructions(applyActions(ofFactory, Collections.singletonList(actionOutput(ofFactory, outPort))))
                .build();
        pushFlow(sw, "--ForwardingFlow--", flowMod);
    }

    /**
     * Installs a rule without instructions, so matching frames are dropped until the hard timeout expires.
     */
    public void installDropRule(SwitchConnection sw, MacAddress src, MacAddress dst, int hardTimeout)
            throws OfInstallException {
        OFFactory ofFactory = sw.getOFFactory();
        OFFlowMod flowMod = prepareFlowModBuilder(ofFactory, DROP_COOKIE, DROP_PRIORITY)
                .setMatch(matchMacPair(ofFactory, src, dst))
                .setHardTimeout(hardTimeout)
                .setInstructions(Collections.emptyList())
                .build();
        pushFlow(sw, "--DropFlow--", flowMod);
    }

    /**
     * Sends the frame of the packet-in out of the given port (or flood). Frames buffered by the switch are referenced
     * by buffer id, other frames are sent back in full.
     */
    public void sendPacketOut(SwitchConnection sw, OFPacketIn packetIn, OFPort inPort, OFPort outPort)
            throws OfInstallException {
        OFFactory ofFactory = sw.getOFFactory();
        OFPacketOut.Builder builder = ofFactory.buildPacketOut()
                .setBufferId(packetIn.getBufferId())
                .setInPort(inPort)
                .setActions(Collections.singletonList(actionOutput(ofFactory, outPort)));
        if (OFBufferId.NO_BUFFER.equals(packetIn.getBufferId())) {
            builder.setData(packetIn.getData());
        }
        pushFlow(sw, "--PacketOut--", builder.build());
    }

    /**
     * Requests counters of every flow in every table.
     */
    public void requestFlowStats(SwitchConnection sw) throws OfInstallException {
        OFFactory ofFactory = sw.getOFFactory();
        OFFlowStatsRequest request = ofFactory.buildFlowStatsRequest()
                .setTableId(TableId.ALL)
                .setOutPort(OFPort.ANY)
                .setOutGroup(OFGroup.ANY)
                .setMatch(ofFactory.buildMatch().build())
                .build();
        pushFlow(sw, "--FlowStatsRequest--", request);
    }

    private long pushFlow(SwitchConnection sw, String flowId, OFMessage message) throws OfInstallException {
        logger.debug("installing {} flow on {}: {}", flowId, sw.getId(), message);

        if (!sw.write(message)) {
            throw new OfInstallException(sw.getId(), message);
        }

        return message.getXid();
    }
}
