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

package org.sentinet.controller.error;

import org.projectfloodlight.openflow.protocol.OFMessage;
import org.projectfloodlight.openflow.types.DatapathId;

public class OfInstallException extends SwitchOperationException {
    private final OFMessage ofMessage;

    public OfInstallException(DatapathId dpId, OFMessage ofMessage) {
        super(dpId, String.format("Error during install OFRule into switch \"%s\"", dpId));
        this.ofMessage = ofMessage;
    }

    public OFMessage getOfMessage() {
        return ofMessage;
    }
}
