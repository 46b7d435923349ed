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

package org.sentinet.controller.utils;

import org.sentinet.model.MacAddress;

import org.projectfloodlight.openflow.protocol.OFFactory;
import org.projectfloodlight.openflow.protocol.OFFlowMod;
import org.projectfloodlight.openflow.protocol.OFPacketIn;
import org.projectfloodlight.openflow.protocol.OFVersion;
import org.projectfloodlight.openflow.protocol.action.OFAction;
import org.projectfloodlight.openflow.protocol.instruction.OFInstruction;
import org.projectfloodlight.openflow.protocol.match.Match;
import org.projectfloodlight.openflow.protocol.match.MatchField;
import org.projectfloodlight.openflow.types.OFBufferId;
import org.projectfloodlight.openflow.types.OFPort;
import org.projectfloodlight.openflow.types.U64;

import java.util.Collections;
import java.util.List;

public final class SwitchFlowUtils {
    /**
     * Output max length asking the switch to send the whole frame instead of a buffer reference.
     */
    public static final int NO_BUFFER_MAX_LEN = 0xffff;

    public static final long TABLE_MISS_COOKIE = 0x8000_0000_0000_0001L;
    public static final long FORWARDING_COOKIE = 0x2000_0000_0000_0000L;
    public static final long DROP_COOKIE = 0x4000_0000_0000_0000L;

    public static final int TABLE_MISS_PRIORITY = 0;
    public static final int FORWARDING_PRIORITY = 1;
    public static final int DROP_PRIORITY = 100;

    /**
     * Create an OFFlowMod builder and set the common fields.
     *
     * @param ofFactory OF factory for particular switch
     * @param cookie cookie
     * @param priority priority
     * @return OFFlowMod builder
     */
    public static OFFlowMod.Builder prepareFlowModBuilder(OFFactory ofFactory, long cookie, int priority) {
        OFFlowMod.Builder fmb = ofFactory.buildFlowAdd();
        fmb.setIdleTimeout(0);
        fmb.setHardTimeout(0);
        fmb.setBufferId(OFBufferId.NO_BUFFER);
        fmb.setCookie(U64.of(cookie));
        fmb.setPriority(priority);
        return fmb;
    }

    /**
     * Create an action to send packet to the controller without buffering it on the switch.
     */
    public static OFAction actionSendToController(OFFactory ofFactory) {
        return ofFactory.actions().buildOutput()
                .setPort(OFPort.CONTROLLER)
                .setMaxLen(NO_BUFFER_MAX_LEN)
                .build();
    }

    public static OFAction actionOutput(OFFactory ofFactory, OFPort port) {
        return ofFactory.actions().output(port, NO_BUFFER_MAX_LEN);
    }

    /**
     * Wrap actions into the single apply-actions instruction.
     */
    public static List<OFInstruction> applyActions(OFFactory ofFactory, List<OFAction> actions) {
        return Collections.singletonList(ofFactory.instructions().applyActions(actions));
    }

    /**
     * Exact match on the source and destination ethernet addresses.
     */
    public static Match matchMacPair(OFFactory ofFactory, MacAddress src, MacAddress dst) {
        return ofFactory.buildMatch()
                .setExact(MatchField.ETH_SRC, toOf(src))
                .setExact(MatchField.ETH_DST, toOf(dst))
                .build();
    }

    /**
     * Exact match on ingress port and the source and destination ethernet addresses.
     */
    public static Match matchPortMacPair(OFFactory ofFactory, OFPort inPort, MacAddress src, MacAddress dst) {
        return ofFactory.buildMatch()
                .setExact(MatchField.IN_PORT, inPort)
                .setExact(MatchField.ETH_SRC, toOf(src))
                .setExact(MatchField.ETH_DST, toOf(dst))
                .build();
    }

    /**
     * Ingress port of the packet-in, taken from the match on OF 1.2 and newer.
     */
    public static OFPort getInPort(OFPacketIn packetIn) {
        if (packetIn.getVersion().compareTo(OFVersion.OF_12) < 0) {
            return packetIn.getInPort();
        }
        return packetIn.getMatch().get(MatchField.IN_PORT);
    }

    public static org.projectfloodlight.openflow.types.MacAddress toOf(MacAddress address) {
        return org.projectfloodlight.openflow.types.MacAddress.of(address.toString());
    }

    public static MacAddress fromOf(org.projectfloodlight.openflow.types.MacAddress address) {
        return new MacAddress(address.toString());
    }

    private SwitchFlowUtils() {
        throw new UnsupportedOperationException();
    }
}
