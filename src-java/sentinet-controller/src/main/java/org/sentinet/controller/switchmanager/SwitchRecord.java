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

import org.sentinet.model.MacAddress;

import lombok.Getter;
import lombok.ToString;
import org.projectfloodlight.openflow.types.DatapathId;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connected datapath and the addresses learned behind its ports.
 */
@Getter
@ToString(exclude = {"connection", "macTable"})
public class SwitchRecord {
    private final String switchId;
    private final DatapathId dpId;
    private final SwitchConnection connection;

    private volatile SwitchState state = SwitchState.CONNECTING;

    private final Map<MacAddress, Integer> macTable = new ConcurrentHashMap<>();

    SwitchRecord(String switchId, SwitchConnection connection) {
        this.switchId = switchId;
        this.dpId = connection.getId();
        this.connection = connection;
    }

    public boolean isActive() {
        return state == SwitchState.ACTIVE;
    }

    public Map<MacAddress, Integer> getMacTable() {
        return Collections.unmodifiableMap(macTable);
    }

    void setState(SwitchState state) {
        this.state = state;
    }

    void learn(MacAddress mac, int port) {
        macTable.put(mac, port);
    }

    Optional<Integer> lookup(MacAddress mac) {
        return Optional.ofNullable(macTable.get(mac));
    }

    void purgeMacTable() {
        macTable.clear();
    }
}
