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

import org.sentinet.controller.error.OfInstallException;
import org.sentinet.controller.statistics.OfFlowStatsMapper.FlowCounters;
import org.sentinet.controller.switchmanager.SwitchManager;
import org.sentinet.controller.switchmanager.SwitchRecord;
import org.sentinet.controller.switchmanager.SwitchRegistry;
import org.sentinet.model.MacAddress;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import org.projectfloodlight.openflow.protocol.OFFlowStatsEntry;
import org.projectfloodlight.openflow.protocol.OFFlowStatsReply;
import org.projectfloodlight.openflow.protocol.OFStatsReplyFlags;
import org.projectfloodlight.openflow.types.DatapathId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Periodic collection of flow counters and conversion into per flow rates.
 *
 * <p>Rates are computed against the counters of the previous poll, so the first observation of a flow reports zero.
 * A flow missing from two consecutive polls of its switch is forgotten.
 */
public class FlowStatisticsService {
    private static final Logger logger = LoggerFactory.getLogger(FlowStatisticsService.class);

    @VisibleForTesting
    static final int MAX_MISSED_POLLS = 2;

    private final SwitchRegistry switchRegistry;
    private final SwitchManager switchManager;

    private final Map<FlowKey, FlowSample> samples = new HashMap<>();
    private final Map<FlowKey, Integer> missedPolls = new HashMap<>();
    private final Map<DatapathId, List<OFFlowStatsEntry>> pendingParts = new HashMap<>();
    private final Map<String, List<FlowRecord>> latestRecords = new ConcurrentHashMap<>();

    public FlowStatisticsService(SwitchRegistry switchRegistry, SwitchManager switchManager) {
        this.switchRegistry = switchRegistry;
        this.switchManager = switchManager;
    }

    /**
     * Request flow counters of every active switch. A switch that can't be written to is skipped.
     */
    public void pollAll() {
        for (SwitchRecord sw : switchRegistry.getActiveSwitches()) {
            logger.trace("Getting flow stats for switch={}", sw.getSwitchId());
            try {
                switchManager.requestFlowStats(sw.getConnection());
            } catch (OfInstallException e) {
                logger.warn("Unable to request flow stats from switch {}: {}", sw.getSwitchId(), e.getMessage());
            }
        }
    }

    /**
     * Consume one part of a flow stats reply.
     *
     * @return records of the switch once the last part of the reply arrived, empty while more parts are expected.
     */
    public Optional<List<FlowRecord>> handleStatsReply(DatapathId dpId, OFFlowStatsReply reply, Instant now) {
        List<OFFlowStatsEntry> entries = pendingParts.computeIfAbsent(dpId, k -> new ArrayList<>());
        entries.addAll(reply.getEntries());
        if (reply.getFlags().contains(OFStatsReplyFlags.REPLY_MORE)) {
            logger.trace("Partial flow stats reply from {}, {} entries so far", dpId, entries.size());
            return Optional.empty();
        }
        pendingParts.remove(dpId);

        String switchId = switchRegistry.getSwitch(dpId)
                .map(SwitchRecord::getSwitchId)
                .orElseGet(() -> switchRegistry.getTopology().switchIdOf(dpId.getLong()));

        List<FlowRecord> records = new ArrayList<>();
        Set<FlowKey> seen = new HashSet<>();
        for (OFFlowStatsEntry entry : entries) {
            Optional<FlowCounters> counters = OfFlowStatsMapper.INSTANCE.toFlowCounters(entry);
            if (counters.isPresent()) {
                FlowRecord record = toRecord(switchId, dpId, counters.get(), now);
                seen.add(record.getKey());
                records.add(record);
            }
        }
        evictMissing(switchId, seen);

        latestRecords.put(switchId, ImmutableList.copyOf(records));
        logger.debug("Switch {} reports {} host flows", switchId, records.size());
        return Optional.of(records);
    }

    /**
     * Drop everything known about the switch, used when it disconnects.
     */
    public void forgetSwitch(DatapathId dpId, String switchId) {
        pendingParts.remove(dpId);
        samples.keySet().removeIf(key -> key.getSwitchId().equals(switchId));
        missedPolls.keySet().removeIf(key -> key.getSwitchId().equals(switchId));
        latestRecords.remove(switchId);
    }

    /**
     * Records of the latest completed poll of every switch.
     */
    public List<FlowRecord> getLatestRecords() {
        return latestRecords.values().stream()
                .flatMap(List::stream)
                .collect(Collectors.toList());
    }

    /**
     * Records of the latest poll filtered by addresses.
     *
     * @param src source address, null to accept any.
     * @param dst destination address, null to accept any.
     */
    public List<FlowRecord> getFlowFeatures(MacAddress src, MacAddress dst) {
        return getLatestRecords().stream()
                .filter(record -> src == null || src.equals(record.getSrcMac()))
                .filter(record -> dst == null || dst.equals(record.getDstMac()))
                .collect(Collectors.toList());
    }

    public List<FlowRecord> getLatestRecords(String switchId) {
        return latestRecords.getOrDefault(switchId, Collections.emptyList());
    }

    @VisibleForTesting
    int getTrackedFlowCount() {
        return samples.size();
    }

    private FlowRecord toRecord(String switchId, DatapathId dpId, FlowCounters counters, Instant now) {
        FlowKey key = new FlowKey(switchId, counters.getSrcMac(), counters.getDstMac());
        FlowSample previous = samples.put(key,
                new FlowSample(counters.getPacketCount(), counters.getByteCount(), now));
        missedPolls.remove(key);

        double pps = 0;
        double bps = 0;
        if (previous != null) {
            double dt = Duration.between(previous.getTimestamp(), now).toMillis() / 1000.0;
            if (dt > 0) {
                pps = Math.max(0, (counters.getPacketCount() - previous.getPacketCount()) / dt);
                bps = Math.max(0, (counters.getByteCount() - previous.getByteCount()) * 8 / dt);
            }
        }

        double avgPktSize = counters.getPacketCount() > 0
                ? (double) counters.getByteCount() / counters.getPacketCount() : 0;

        return FlowRecord.builder()
                .switchId(switchId)
                .datapathId(dpId.getLong())
                .srcMac(counters.getSrcMac())
                .dstMac(counters.getDstMac())
                .packetCount(counters.getPacketCount())
                .byteCount(counters.getByteCount())
                .durationSec(counters.getDurationSec())
                .pps(pps)
                .bps(bps)
                .avgPktSize(avgPktSize)
                .outPort(counters.getOutPort())
                .timestamp(now.toEpochMilli())
                .build();
    }

    private void evictMissing(String switchId, Set<FlowKey> seen) {
        Iterator<FlowKey> keys = samples.keySet().iterator();
        while (keys.hasNext()) {
            FlowKey key = keys.next();
            if (!key.getSwitchId().equals(switchId) || seen.contains(key)) {
                continue;
            }

            int missed = missedPolls.merge(key, 1, Integer::sum);
            if (missed >= MAX_MISSED_POLLS) {
                logger.debug("Forget flow {}, absent from {} polls", key, missed);
                keys.remove();
                missedPolls.remove(key);
            }
        }
    }
}
