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

package org.sentinet.controller.forwarding;

import lombok.Value;

/**
 * Outcome of a packet-in.
 */
@Value
public class ForwardingDecision {
    public enum Action {
        /**
         * Frame was not processed at all, like link discovery traffic.
         */
        IGNORE,
        DROP,
        OUTPUT,
        FLOOD
    }

    private static final ForwardingDecision IGNORED = new ForwardingDecision(Action.IGNORE, 0, false);
    private static final ForwardingDecision DROPPED = new ForwardingDecision(Action.DROP, 0, false);
    private static final ForwardingDecision FLOODED = new ForwardingDecision(Action.FLOOD, 0, false);

    Action action;
    int port;
    boolean navigatorRouted;

    public static ForwardingDecision ignore() {
        return IGNORED;
    }

    public static ForwardingDecision drop() {
        return DROPPED;
    }

    public static ForwardingDecision flood() {
        return FLOODED;
    }

    public static ForwardingDecision output(int port, boolean navigatorRouted) {
        return new ForwardingDecision(Action.OUTPUT, port, navigatorRouted);
    }
}
