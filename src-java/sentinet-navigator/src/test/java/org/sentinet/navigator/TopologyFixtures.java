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

package org.sentinet.navigator;

import org.sentinet.model.MacAddress;
import org.sentinet.model.topology.HostDescriptor;
import org.sentinet.model.topology.LinkDescriptor;
import org.sentinet.model.topology.SwitchDescriptor;
import org.sentinet.model.topology.Topology;
import org.sentinet.model.topology.TopologyDescriptor;

import java.util.Random;

final class TopologyFixtures {

    /**
     * Fast direct s1-s4 link and a slow three hop detour through s2 and s3.
     */
    static Topology diamond() {
        return Topology.fromDescriptor(builder(4)
                .addHost(host(1, "s1"))
                .addHost(host(2, "s4"))
                .addLink(link("s1", "s4", 100, 1))
                .addLink(link("s1", "s2", 10, 10))
                .addLink(link("s2", "s3", 10, 10))
                .addLink(link("s3", "s4", 10, 10))
                .build());
    }

    /**
     * Every switch linked to its successor and to the switch after the next one.
     */
    static Topology mesh(int size) {
        TopologyDescriptor.TopologyDescriptorBuilder builder = builder(size);
        for (int i = 1; i < size; i++) {
            builder.addLink(link("s" + i, "s" + (i + 1), 100, i % 3 + 1));
            if (i + 2 <= size) {
                builder.addLink(link("s" + i, "s" + (i + 2), 50, i % 4 + 2));
            }
        }
        return Topology.fromDescriptor(builder.build());
    }

    static TopologyDescriptor.TopologyDescriptorBuilder builder(int switches) {
        TopologyDescriptor.TopologyDescriptorBuilder builder = TopologyDescriptor.builder();
        for (int i = 1; i <= switches; i++) {
            builder.addSwitch(new SwitchDescriptor("s" + i, i, "access"));
        }
        return builder;
    }

    static LinkDescriptor link(String from, String to, double bandwidth, double delay) {
        return LinkDescriptor.builder().from(from).to(to).bandwidthMbps(bandwidth).delayMs(delay).build();
    }

    static HostDescriptor host(int index, String switchId) {
        return new HostDescriptor("h" + index, mac(index), "10.0.0." + index, switchId);
    }

    static MacAddress mac(int index) {
        return new MacAddress(String.format("00:00:00:00:00:%02x", index));
    }

    /**
     * Fails the test as soon as the exploration branch consults it.
     */
    static final class GuardedRandom extends Random {
        private boolean armed;

        GuardedRandom() {
            super(7);
        }

        void arm() {
            armed = true;
        }

        @Override
        public double nextDouble() {
            if (armed) {
                throw new AssertionError("Randomness consulted");
            }
            return super.nextDouble();
        }

        @Override
        public int nextInt(int bound) {
            if (armed) {
                throw new AssertionError("Randomness consulted");
            }
            return super.nextInt(bound);
        }
    }

    private TopologyFixtures() {
    }
}
