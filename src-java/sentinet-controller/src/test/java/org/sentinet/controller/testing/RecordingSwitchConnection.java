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

package org.sentinet.controller.testing;

import org.sentinet.controller.switchmanager.SwitchConnection;

import org.projectfloodlight.openflow.protocol.OFFactories;
import org.projectfloodlight.openflow.protocol.OFFactory;
import org.projectfloodlight.openflow.protocol.OFMessage;
import org.projectfloodlight.openflow.protocol.OFVersion;
import org.projectfloodlight.openflow.types.DatapathId;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * OF 1.3 switch connection keeping everything written into it.
 */
public class RecordingSwitchConnection implements SwitchConnection {
    private final DatapathId dpId;
    private final OFFactory factory = OFFactories.getFactory(OFVersion.OF_13);
    private final List<OFMessage> written = new ArrayList<>();
    private boolean writable = true;

    public RecordingSwitchConnection(long dpid) {
        this.dpId = DatapathId.of(dpid);
    }

    @Override
    public DatapathId getId() {
        return dpId;
    }

    @Override
    public OFFactory getOFFactory() {
        return factory;
    }

    @Override
    public boolean write(OFMessage message) {
        if (!writable) {
            return false;
        }
        written.add(message);
        return true;
    }

    public void setWritable(boolean writable) {
        this.writable = writable;
    }

    public List<OFMessage> getWritten() {
        return written;
    }

    public <T extends OFMessage> List<T> getWritten(Class<T> type) {
        return written.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    public void clear() {
        written.clear();
    }
}
