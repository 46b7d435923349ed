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

package org.sentinet.controller.statistics;

import org.sentinet.controller.utils.SwitchFlowUtils;
import org.sentinet.model.MacAddress;

import lombok.Value;
import org.projectfloodlight.openflow.protocol.OFFlowStatsEntry;
import org.projectfloodlight.openflow.protocol.action.OFAction;
import org.projectfloodlight.openflow.protocol.action.OFActionOutput;
import org.projectfloodlight.openflow.protocol.instruction.OFInstruction;
import org.projectfloodlight.openflow.protocol.instruction.OFInstructionApplyActions;
import org.projectfloodlight.openflow.protocol.match.Match;
import org.projectfloodlight.openflow.protocol.match.MatchField;

import java.util.List;
import java.util.Optional;

/**
 * Converts flow stats entries read from the switch into counters of host flows.
 */
public final class OfFlowStatsMapper {
    public static final OfFlowStatsMapper INSTANCE = new OfFlowStatsMapper();

    /**
     * Convert {@link OFFlowStatsEntry} of a host forwarding rule into {@link FlowCounters}.
     *
     * @param entry flow stats to be converted.
     * @return empty for the table-miss rule, drop rules and any rule that doesn't match an address pair.
     */
    public Optional<FlowCounters> toFlowCounters(OFFlowStatsEntry entry) {
        if (entry.getPriority() != SwitchFlowUtils.FORWARDING_PRIORITY) {
            return Optional.empty();
        }

        Match match = entry.getMatch();
        org.projectfloodlight.openflow.types.MacAddress src = match.get(MatchField.ETH_SRC);
        org.projectfloodlight.openflow.types.MacAddress dst = match.get(MatchField.ETH_DST);
        if (src == null || dst == null) {
            return Optional.empty();
        }

        return Optional.of(new FlowCounters(
                SwitchFlowUtils.fromOf(src),
                SwitchFlowUtils.fromOf(dst),
                entry.getPacketCount().getValue(),
                entry.getByteCount().getValue(),
                entry.getDurationSec(),
                getOutPort(entry.getInstructions())));
    }

    /**
     * Port of the first output action of the apply-actions instruction, 0 when the rule has none.
     */
    public int getOutPort(List<OFInstruction> instructions) {
        for (OFInstruction instruction : instructions) {
            if (instruction instanceof OFInstructionApplyActions) {
                for (OFAction action : ((OFInstructionApplyActions) instruction).getActions()) {
                    if (action instanceof OFActionOutput) {
                        return ((OFActionOutput) action).getPort().getPortNumber();
                    }
                }
            }
        }
        return 0;
    }

    private OfFlowStatsMapper() {
    }

    @Value
    public static class FlowCounters {
        MacAddress srcMac;
        MacAddress dstMac;
        long packetCount;
        long byteCount;
        long durationSec;
        int outPort;
    }
}
