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

import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.sentinet.controller.utils.SwitchFlowUtils.toOf;

import org.sentinet.controller.error.OfInstallException;
import org.sentinet.controller.testing.OfTestMessages;
import org.sentinet.controller.utils.SwitchFlowUtils;
import org.sentinet.model.MacAddress;

import org.easymock.Capture;
import org.junit.Before;
import org.junit.Test;
import org.projectfloodlight.openflow.protocol.OFFactory;
import org.projectfloodlight.openflow.protocol.OFFlowAdd;
import org.projectfloodlight.openflow.protocol.OFFlowMod;
import org.projectfloodlight.openflow.protocol.OFFlowStatsRequest;
import org.projectfloodlight.openflow.protocol.OFMessage;
import org.projectfloodlight.openflow.protocol.OFPacketIn;
import org.projectfloodlight.openflow.protocol.OFPacketOut;
import org.projectfloodlight.openflow.protocol.action.OFActionOutput;
import org.projectfloodlight.openflow.protocol.instruction.OFInstructionApplyActions;
import org.projectfloodlight.openflow.protocol.match.MatchField;
import org.projectfloodlight.openflow.types.DatapathId;
import org.projectfloodlight.openflow.types.OFBufferId;
import org.projectfloodlight.openflow.types.OFGroup;
import org.projectfloodlight.openflow.types.OFPort;
import org.projectfloodlight.openflow.types.TableId;
import org.projectfloodlight.openflow.types.U64;

public class SwitchManagerTest {
    private static final DatapathId DPID = DatapathId.of(1);
    private static final MacAddress SRC = new MacAddress("00:00:00:00:00:01");
    private static final MacAddress DST = new MacAddress("00:00:00:00:00:02");

    private final OFFactory ofFactory = OfTestMessages.OF_13;
    private final SwitchManager switchManager = new SwitchManager();
    private SwitchConnection sw;

    @Before
    public void setUp() {
        sw = createMock(SwitchConnection.class);
        expect(sw.getId()).andReturn(DPID).anyTimes();
        expect(sw.getOFFactory()).andReturn(ofFactory).anyTimes();
    }

    @Test
    public void installTableMissRule() throws Exception {
        Capture<OFMessage> capture = prepareForWrite(true);

        switchManager.installTableMissRule(sw);

        verify(sw);
        OFFlowMod flowMod = (OFFlowMod) capture.getValue();
        assertThat(flowMod, instanceOf(OFFlowAdd.class));
        assertEquals(SwitchFlowUtils.TABLE_MISS_PRIORITY, flowMod.getPriority());
        assertEquals(U64.of(SwitchFlowUtils.TABLE_MISS_COOKIE), flowMod.getCookie());
        assertThat(flowMod.getMatch().getMatchFields().iterator().hasNext(), is(false));
        assertEquals(0, flowMod.getIdleTimeout());
        assertEquals(0, flowMod.getHardTimeout());

        OFActionOutput output = singleOutput(flowMod);
        assertEquals(OFPort.CONTROLLER, output.getPort());
        assertEquals(SwitchFlowUtils.NO_BUFFER_MAX_LEN, output.getMaxLen());
    }

    @Test
    public void installForwardingRule() throws Exception {
        Capture<OFMessage> capture = prepareForWrite(true);

        switchManager.installForwardingRule(sw, OFPort.of(3), SRC, DST, OFPort.of(2), 30, 300);

        verify(sw);
        OFFlowMod flowMod = (OFFlowMod) capture.getValue();
        assertEquals(SwitchFlowUtils.FORWARDING_PRIORITY, flowMod.getPriority());
        assertEquals(30, flowMod.getIdleTimeout());
        assertEquals(300, flowMod.getHardTimeout());
        assertEquals(OFPort.of(3), flowMod.getMatch().get(MatchField.IN_PORT));
        assertEquals(toOf(SRC), flowMod.getMatch().get(MatchField.ETH_SRC));
        assertEquals(toOf(DST), flowMod.getMatch().get(MatchField.ETH_DST));
        assertEquals(OFPort.of(2), singleOutput(flowMod).getPort());
    }

    @Test
    public void installDropRule() throws Exception {
        Capture<OFMessage> capture = prepareForWrite(true);

        switchManager.installDropRule(sw, SRC, DST, 60);

        verify(sw);
        OFFlowMod flowMod = (OFFlowMod) capture.getValue();
        assertEquals(SwitchFlowUtils.DROP_PRIORITY, flowMod.getPriority());
        assertEquals(0, flowMod.getIdleTimeout());
        assertEquals(60, flowMod.getHardTimeout());
        assertNull(flowMod.getMatch().get(MatchField.IN_PORT));
        assertEquals(toOf(SRC), flowMod.getMatch().get(MatchField.ETH_SRC));
        assertEquals(toOf(DST), flowMod.getMatch().get(MatchField.ETH_DST));
        assertThat(flowMod.getInstructions(), empty());
    }

    @Test
    public void requestFlowStatsOfAllTables() throws Exception {
        Capture<OFMessage> capture = prepareForWrite(true);

        switchManager.requestFlowStats(sw);

        verify(sw);
        OFFlowStatsRequest request = (OFFlowStatsRequest) capture.getValue();
        assertEquals(TableId.ALL, request.getTableId());
        assertEquals(OFPort.ANY, request.getOutPort());
        assertEquals(OFGroup.ANY, request.getOutGroup());
    }

    @Test
    public void packetOutCarriesDataOfUnbufferedFrame() throws Exception {
        Capture<OFMessage> capture = prepareForWrite(true);
        byte[] data = OfTestMessages.frame(SRC, DST, OfTestMessages.ETH_TYPE_IPV4);
        OFPacketIn packetIn = OfTestMessages.packetIn(3, data);

        switchManager.sendPacketOut(sw, packetIn, OFPort.of(3), OFPort.FLOOD);

        verify(sw);
        OFPacketOut packetOut = (OFPacketOut) capture.getValue();
        assertEquals(OFBufferId.NO_BUFFER, packetOut.getBufferId());
        assertEquals(OFPort.of(3), packetOut.getInPort());
        assertEquals(OFPort.FLOOD, ((OFActionOutput) packetOut.getActions().get(0)).getPort());
        assertArrayEquals(data, packetOut.getData());
    }

    @Test
    public void packetOutReusesSwitchBuffer() throws Exception {
        Capture<OFMessage> capture = prepareForWrite(true);
        OFPacketIn packetIn = OfTestMessages.packetIn(3,
                OfTestMessages.frame(SRC, DST, OfTestMessages.ETH_TYPE_IPV4), OFBufferId.of(42));

        switchManager.sendPacketOut(sw, packetIn, OFPort.of(3), OFPort.of(1));

        verify(sw);
        OFPacketOut packetOut = (OFPacketOut) capture.getValue();
        assertEquals(OFBufferId.of(42), packetOut.getBufferId());
        assertEquals(0, packetOut.getData().length);
    }

    @Test(expected = OfInstallException.class)
    public void failedWriteRaisesInstallException() throws Exception {
        prepareForWrite(false);

        switchManager.installDropRule(sw, SRC, DST, 60);
    }

    private Capture<OFMessage> prepareForWrite(boolean result) {
        Capture<OFMessage> capture = newCapture();
        expect(sw.write(capture(capture))).andReturn(result);
        replay(sw);
        return capture;
    }

    private OFActionOutput singleOutput(OFFlowMod flowMod) {
        assertEquals(1, flowMod.getInstructions().size());
        OFInstructionApplyActions applyActions = (OFInstructionApplyActions) flowMod.getInstructions().get(0);
        assertEquals(1, applyActions.getActions().size());
        return (OFActionOutput) applyActions.getActions().get(0);
    }
}
