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

package org.sentinet.controller.bridge;

import java.util.Optional;

/**
 * Channel to the dashboard backend.
 */
public interface BridgeTransport extends AutoCloseable {
    /**
     * Deliver the message, blocking until the backend accepted it.
     *
     * @throws BridgeTransportException if the backend is unreachable or rejected the message.
     */
    void send(BridgeMessage message) throws BridgeTransportException;

    /**
     * Take the next queued operator command, if any. May block while the backend is asked for new commands.
     */
    Optional<PendingCommand> pollCommand();

    @Override
    void close();
}
