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

import org.sentinet.controller.error.OfInstallException;
import org.sentinet.controller.error.SwitchNotFoundException;
import org.sentinet.controller.error.SwitchOperationException;
import org.sentinet.model.MacAddress;
import org.sentinet.model.topology.Topology;

import org.projectfloodlight.openflow.types.DatapathId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Tracks the lifecycle of connected datapaths and the addresses learned on their ports.
 */
public class SwitchRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SwitchRegistry.class);

    private final Topology topology;
    private final SwitchManager switchManager;

    private final Map<DatapathId, SwitchRecord> switchesByDpId = new ConcurrentHashMap<>();
    private final Map<String, SwitchRecord> switchesById = new ConcurrentHashMap<>();

    public SwitchRegistry(Topology topology, SwitchManager switchManager) {
        this.topology = topology;
        this.switchManager = switchManager;
    }

    /**
     * Register the datapath and install its table-miss rule. A reconnect of a known datapath replaces the old
     * record, so learning starts over.
     *
     * @throws SwitchOperationException if the table-miss rule can't be written, the switch is left DEAD.
     */
    public SwitchRecord handleConnect(SwitchConnection connection) throws SwitchOperationException {
        DatapathId dpId = connection.getId();
        String switchId = topology.switchIdOf(dpId.getLong());
        SwitchRecord record = new SwitchRecord(switchId, connection);

        SwitchRecord previous = switchesByDpId.put(dpId, record);
        switchesById.put(switchId, record);
        if (previous != null) {
            logger.info("Switch {} ({}) reconnected, dropping previous session", switchId, dpId);
            previous.setState(SwitchState.DEAD);
            previous.purgeMacTable();
        }

        try {
            switchManager.installTableMissRule(connection);
        } catch (OfInstallException e) {
            logger.error("Unable to install table-miss rule on switch {} ({})", switchId, dpId);
            record.setState(SwitchState.DEAD);
            throw e;
        }

        record.setState(SwitchState.ACTIVE);
        logger.info("Switch {} ({}) is active", switchId, dpId);
        return record;
    }

    /**
     * Mark the datapath DEAD and forget everything learned on it.
     *
     * @return the record of the switch, empty if the datapath was never registered.
     */
    public Optional<SwitchRecord> handleDisconnect(DatapathId dpId) {
        SwitchRecord record = switchesByDpId.get(dpId);
        if (record == null) {
            logger.warn("Disconnect of unknown switch {}", dpId);
            return Optional.empty();
        }

        record.setState(SwitchState.DEAD);
        record.purgeMacTable();
        logger.info("Switch {} ({}) disconnected", record.getSwitchId(), dpId);
        return Optional.of(record);
    }

    /**
     * Remember the port the address was seen on. The latest observation wins.
     */
    public void learnSource(String switchId, MacAddress mac, int port) {
        SwitchRecord record = switchesById.get(switchId);
        if (record == null || !record.isActive()) {
            logger.debug("Skip learning {} on port {} of inactive switch {}", mac, port, switchId);
            return;
        }

        Optional<Integer> known = record.lookup(mac);
        if (!known.isPresent() || known.get() != port) {
            logger.debug("Learned {} on port {} of switch {}", mac, port, switchId);
        }
        record.learn(mac, port);
    }

    /**
     * Port the address was learned on, empty for unknown or inactive switches.
     */
    public Optional<Integer> lookupPort(String switchId, MacAddress mac) {
        SwitchRecord record = switchesById.get(switchId);
        if (record == null || !record.isActive()) {
            return Optional.empty();
        }
        return record.lookup(mac);
    }

    public Collection<SwitchRecord> getActiveSwitches() {
        return switchesByDpId.values().stream()
                .filter(SwitchRecord::isActive)
                .collect(Collectors.toList());
    }

    public Optional<SwitchRecord> getSwitch(String switchId) {
        return Optional.ofNullable(switchesById.get(switchId));
    }

    public Optional<SwitchRecord> getSwitch(DatapathId dpId) {
        return Optional.ofNullable(switchesByDpId.get(dpId));
    }

    /**
     * Connection of an active switch.
     *
     * @throws SwitchNotFoundException if the switch is not connected.
     */
    public SwitchConnection lookupConnection(String switchId) throws SwitchNotFoundException {
        SwitchRecord record = switchesById.get(switchId);
        if (record == null || !record.isActive()) {
            throw new SwitchNotFoundException(switchId);
        }
        return record.getConnection();
    }

    public Topology getTopology() {
        return topology;
    }
}
