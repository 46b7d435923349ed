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

/**
 * Traffic classifier backed by trained models.
 */
public interface ThreatClassifier {
    /**
     * Classify the traffic of a flow.
     *
     * @param pps packets per second.
     * @param bps bits per second.
     * @param avgPktSize average packet size in bytes.
     */
    Classification classify(double pps, double bps, double avgPktSize);
}
