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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.sentinet.controller.testing.OfTestMessages;
import org.sentinet.model.MacAddress;

import org.junit.Test;

import java.util.Arrays;
import java.util.Optional;

public class EthernetFrameTest {
    private static final MacAddress SRC = new MacAddress("00:00:00:00:00:01");
    private static final MacAddress DST = new MacAddress("aa:bb:cc:dd:ee:fe");
    private static final MacAddress BROADCAST = new MacAddress("ff:ff:ff:ff:ff:ff");

    @Test
    public void headerFieldsAreRead() {
        Optional<EthernetFrame> frame = EthernetFrame.parse(
                OfTestMessages.frame(SRC, DST, OfTestMessages.ETH_TYPE_IPV4));

        assertTrue(frame.isPresent());
        assertEquals(SRC, frame.get().getSource());
        assertEquals(DST, frame.get().getDestination());
        assertEquals(OfTestMessages.ETH_TYPE_IPV4, frame.get().getEtherType());
        assertFalse(frame.get().isControlNoise());
    }

    @Test
    public void vlanTagIsSkipped() {
        Optional<EthernetFrame> frame = EthernetFrame.parse(
                OfTestMessages.taggedFrame(SRC, DST, 100, EthernetFrame.ETH_TYPE_LLDP));

        assertTrue(frame.isPresent());
        assertEquals(EthernetFrame.ETH_TYPE_LLDP, frame.get().getEtherType());
        assertTrue(frame.get().isControlNoise());
    }

    @Test
    public void ipv6IsControlNoise() {
        EthernetFrame frame = EthernetFrame.parse(
                OfTestMessages.frame(SRC, DST, EthernetFrame.ETH_TYPE_IPV6)).get();

        assertTrue(frame.isControlNoise());
    }

    @Test
    public void broadcastDestinationIsRead() {
        EthernetFrame frame = EthernetFrame.parse(
                OfTestMessages.frame(SRC, BROADCAST, OfTestMessages.ETH_TYPE_IPV4)).get();

        assertEquals(BROADCAST, frame.getDestination());
        assertTrue(frame.getDestination().isMulticast());
    }

    @Test
    public void truncatedIpv4PayloadIsNotParsed() {
        byte[] frame = Arrays.copyOf(OfTestMessages.frame(SRC, DST, OfTestMessages.ETH_TYPE_IPV4), 18);

        assertFalse(EthernetFrame.parse(frame).isPresent());
    }

    @Test
    public void truncatedFrameIsNotParsed() {
        assertFalse(EthernetFrame.parse(new byte[13]).isPresent());
        assertFalse(EthernetFrame.parse(null).isPresent());
    }
}
