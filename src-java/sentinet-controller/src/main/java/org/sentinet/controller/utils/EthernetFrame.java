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

import lombok.Value;
import org.onlab.packet.DeserializationException;
import org.onlab.packet.Ethernet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Ethernet header fields of a frame delivered with a packet-in.
 */
@Value
public class EthernetFrame {
    private static final Logger logger = LoggerFactory.getLogger(EthernetFrame.class);

    public static final int ETH_TYPE_LLDP = Ethernet.TYPE_LLDP & 0xffff;
    public static final int ETH_TYPE_IPV6 = Ethernet.TYPE_IPV6 & 0xffff;

    MacAddress destination;
    MacAddress source;
    int etherType;

    /**
     * Decode the frame. VLAN and QinQ tags are consumed, the ether type is the one of the payload.
     *
     * @return empty when the data can't be decoded as an ethernet frame.
     */
    public static Optional<EthernetFrame> parse(byte[] data) {
        if (data == null) {
            return Optional.empty();
        }

        Ethernet ethernet;
        try {
            ethernet = Ethernet.deserializer().deserialize(data, 0, data.length);
        } catch (DeserializationException e) {
            logger.debug("Unable to decode packet-in payload of {} bytes: {}", data.length, e.getMessage());
            return Optional.empty();
        }
        return Optional.of(new EthernetFrame(
                toMac(ethernet.getDestinationMACAddress()),
                toMac(ethernet.getSourceMACAddress()),
                ethernet.getEtherType() & 0xffff));
    }

    /**
     * Link discovery and IPv6 control traffic is never forwarded by the controller.
     */
    public boolean isControlNoise() {
        return etherType == ETH_TYPE_LLDP || etherType == ETH_TYPE_IPV6;
    }

    private static MacAddress toMac(byte[] raw) {
        return SwitchFlowUtils.fromOf(org.projectfloodlight.openflow.types.MacAddress.of(raw));
    }
}
