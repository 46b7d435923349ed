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

package org.sentinet.controller.statistics;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import org.sentinet.model.MacAddress;
import org.sentinet.model.topology.DirectedLink;
import org.sentinet.model.topology.Topology;

import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

public class LinkUtilizationCalculatorTest {
    private static final MacAddress HOST_1 = new MacAddress("00:00:00:00:00:01");
    private static final MacAddress HOST_4 = new MacAddress("00:00:00:00:00:04");

    private final LinkUtilizationCalculator calculator =
            new LinkUtilizationCalculator(Topology.loadResource("topology-sample.json"));

    @Test
    public void flowsAreAttributedToTheLinkOfTheirOutPort() {
        // s3 port 4 and s2 port 2 face s2 and s1, host ports carry no link traffic
        Map<DirectedLink, Double> usage = calculator.calculate(Arrays.asList(
                record("s3", HOST_1, HOST_4, 4, 1_000_000),
                record("s3", HOST_1, HOST_4, 4, 500_000),
                record("s2", HOST_4, HOST_1, 3, 2_000_000),
                record("s3", HOST_4, HOST_1, 1, 9_000_000)));

        assertEquals(2, usage.size());
        assertEquals(1_500_000, usage.get(new DirectedLink("s3", "s2")), 0.001);
        assertEquals(2_000_000, usage.get(new DirectedLink("s2", "s3")), 0.001);
        assertFalse(usage.containsKey(new DirectedLink("s3", "s1")));
    }

    @Test
    public void linkStatsSumBothDirections() {
        List<LinkStats> stats = calculator.getLinkStats(Arrays.asList(
                record("s3", HOST_1, HOST_4, 4, 10_000_000),
                record("s2", HOST_4, HOST_1, 3, 5_000_000)));

        assertThat(stats, hasSize(4));
        LinkStats s2s3 = stats.get(3);
        assertEquals("s2", s2s3.getFrom());
        assertEquals("s3", s2s3.getTo());
        assertEquals(50_000_000, s2s3.getBandwidthBps(), 0.001);
        assertEquals(15_000_000, s2s3.getUsageBps(), 0.001);
        assertThat(s2s3.getUtilizationPct(), closeTo(30, 0.0001));

        LinkStats s1s2 = stats.get(0);
        assertEquals(0, s1s2.getUsageBps(), 0);
        assertEquals(0, s1s2.getUtilizationPct(), 0);
    }

    private static FlowRecord record(String switchId, MacAddress src, MacAddress dst, int outPort, double bps) {
        return FlowRecord.builder()
                .switchId(switchId)
                .srcMac(src)
                .dstMac(dst)
                .outPort(outPort)
                .bps(bps)
                .build();
    }
}
