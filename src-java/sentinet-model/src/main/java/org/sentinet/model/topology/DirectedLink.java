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

package org.sentinet.model.topology;

import lombok.NonNull;
import lombok.Value;

import java.io.Serializable;

/**
 * One direction of a switch to switch link.
 */
@Value
public class DirectedLink implements Serializable {
    private static final long serialVersionUID = 1L;

    @NonNull
    String from;

    @NonNull
    String to;

    public DirectedLink reverse() {
        return new DirectedLink(to, from);
    }

    @Override
    public String toString() {
        return from + "->" + to;
    }
}
