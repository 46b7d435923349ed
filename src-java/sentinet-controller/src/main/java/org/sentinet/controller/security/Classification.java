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

package org.sentinet.controller.security;

import lombok.Builder;
import lombok.Value;

/**
 * Result of a classifier call.
 */
@Value
@Builder
public class Classification {
    private static final Classification UNAVAILABLE = Classification.builder().available(false).build();

    /**
     * False when the classifier has no model loaded, the other fields are meaningless then.
     */
    boolean available;

    /**
     * Verdict of the anomaly detector.
     */
    boolean threat;

    /**
     * Name of the attack class, {@code null} when the class model gave no answer.
     */
    String attackType;

    double confidence;

    public static Classification unavailable() {
        return UNAVAILABLE;
    }
}
