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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.sentinet.controller.config.BridgeConfig;
import org.sentinet.controller.testing.TestConfigs;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;
import java.util.Optional;

public class KafkaBridgeTransportTest {
    private static final String EVENTS = "test.events";
    private static final String COMMANDS = "test.commands";

    private final TopicPartition commandsPartition = new TopicPartition(COMMANDS, 0);

    private MockProducer<String, String> producer;
    private MockConsumer<String, String> consumer;
    private KafkaBridgeTransport transport;
    private long offset;

    @Before
    public void setUp() {
        BridgeConfig config = TestConfigs.bridge("enabled", "true", "events-topic", EVENTS, "commands-topic", COMMANDS);
        producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        transport = new KafkaBridgeTransport(config, producer, consumer);

        consumer.rebalance(Collections.singletonList(commandsPartition));
        consumer.updateBeginningOffsets(ImmutableMap.of(commandsPartition, 0L));
        offset = 0;
    }

    @Test
    public void envelopeIsWrittenIntoEventsTopic() throws Exception {
        transport.send(new BridgeMessage(BridgeMessageType.SWITCH_EVENT, 1700000000000L, ImmutableMap.of(
                "event", "connected", "switch_id", "s1", "dpid", 1L)));

        assertEquals(1, producer.history().size());
        ProducerRecord<String, String> record = producer.history().get(0);
        assertEquals(EVENTS, record.topic());
        assertEquals("switch_event", record.key());

        JsonNode envelope = KafkaBridgeTransport.MAPPER.readTree(record.value());
        assertEquals("switch_event", envelope.get("type").asText());
        assertEquals(1700000000000L, envelope.get("timestamp").asLong());
        assertEquals("connected", envelope.get("data").get("event").asText());
        assertEquals("s1", envelope.get("data").get("switch_id").asText());
        assertEquals(1, envelope.get("data").get("dpid").asInt());
    }

    @Test
    public void producerFailureIsReportedAsTransportError() {
        producer.sendException = new KafkaException("broker unavailable");

        try {
            transport.send(new BridgeMessage(BridgeMessageType.TOPOLOGY, 0, Collections.emptyMap()));
            fail("expected BridgeTransportException");
        } catch (BridgeTransportException e) {
            assertTrue(e.getMessage().contains(EVENTS));
        }
    }

    @Test
    public void commandsAreReadInOrder() {
        addCommand("{\"command\": \"block\", \"target\": \"10.0.0.1\", \"duration\": 30}");
        addCommand("{\"command\": \"block\", \"target\": \"00:00:00:00:00:02\"}");

        assertEquals(Optional.of(new PendingCommand("block", "10.0.0.1", 30)), transport.pollCommand());
        assertEquals(Optional.of(new PendingCommand("block", "00:00:00:00:00:02", 60)), transport.pollCommand());
        assertFalse(transport.pollCommand().isPresent());
    }

    @Test
    public void malformedCommandIsSkipped() {
        addCommand("not a json");
        addCommand("{\"command\": \"block\", \"target\": \"10.0.0.3\", \"duration\": 5, \"origin\": \"dashboard\"}");

        Optional<PendingCommand> command = transport.pollCommand();
        assertTrue(command.isPresent());
        assertEquals("10.0.0.3", command.get().getTarget());
        assertEquals(5, command.get().getDurationSec());
        assertFalse(transport.pollCommand().isPresent());
    }

    @Test
    public void closeReleasesClients() {
        transport.close();

        assertTrue(producer.closed());
        assertTrue(consumer.closed());
    }

    private void addCommand(String payload) {
        consumer.addRecord(new ConsumerRecord<>(COMMANDS, 0, offset++, null, payload));
    }
}
