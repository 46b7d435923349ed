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

import org.sentinet.controller.config.BridgeConfig;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes JSON envelopes into the events topic and reads operator commands from the commands topic.
 */
public class KafkaBridgeTransport implements BridgeTransport {
    private static final Logger logger = LoggerFactory.getLogger(KafkaBridgeTransport.class);

    @VisibleForTesting
    static final ObjectMapper MAPPER = new ObjectMapper();

    private final BridgeConfig config;
    private final Producer<String, String> producer;
    private final Consumer<String, String> consumer;

    private final Deque<PendingCommand> received = new ArrayDeque<>();

    public KafkaBridgeTransport(BridgeConfig config) {
        this(config, new KafkaProducer<>(config.createKafkaProducerProperties()),
                new KafkaConsumer<>(config.createKafkaConsumerProperties()));
    }

    @VisibleForTesting
    KafkaBridgeTransport(BridgeConfig config, Producer<String, String> producer, Consumer<String, String> consumer) {
        this.config = config;
        this.producer = producer;
        this.consumer = consumer;

        consumer.subscribe(Collections.singletonList(config.getCommandsTopic()));
        logger.info("Kafka bridge: events into {}, commands from {}",
                config.getEventsTopic(), config.getCommandsTopic());
    }

    @Override
    public void send(BridgeMessage message) throws BridgeTransportException {
        String payload;
        try {
            payload = MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new BridgeTransportException(String.format("Can not serialize %s message", message.getType()), e);
        }

        logger.trace("Posting: topic={}, message={}", config.getEventsTopic(), payload);
        ProducerRecord<String, String> record =
                new ProducerRecord<>(config.getEventsTopic(), message.getType().getValue(), payload);
        try {
            producer.send(record).get(config.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgeTransportException("Interrupted while sending into " + config.getEventsTopic(), e);
        } catch (ExecutionException | TimeoutException | KafkaException e) {
            throw new BridgeTransportException("Unable to send into " + config.getEventsTopic(), e);
        }
    }

    /**
     * Must be called from a single thread, the Kafka consumer is not thread safe.
     */
    @Override
    public Optional<PendingCommand> pollCommand() {
        if (received.isEmpty()) {
            ConsumerRecords<String, String> batch = consumer.poll(config.getCommandPollTimeout());
            for (ConsumerRecord<String, String> record : batch) {
                handle(record);
            }
        }
        return Optional.ofNullable(received.poll());
    }

    @Override
    public void close() {
        producer.close();
        consumer.close();
    }

    private void handle(ConsumerRecord<String, String> record) {
        logger.trace("received command: {} - {}", record.offset(), record.value());
        try {
            received.add(MAPPER.readValue(record.value(), PendingCommand.class));
        } catch (JsonProcessingException e) {
            logger.error("Skip malformed command at offset {}: {}", record.offset(), record.value(), e);
        }
    }
}
