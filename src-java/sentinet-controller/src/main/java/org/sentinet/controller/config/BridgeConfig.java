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

package org.sentinet.controller.config;

import com.sabre.oss.conf4j.annotation.Configuration;
import com.sabre.oss.conf4j.annotation.Default;
import com.sabre.oss.conf4j.annotation.Description;
import com.sabre.oss.conf4j.annotation.Key;

import java.io.Serializable;
import java.time.Duration;
import java.util.Properties;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;

@Configuration
@Key("sentinet.bridge")
public interface BridgeConfig extends Serializable {
    @Key("enabled")
    @Default("false")
    boolean isEnabled();

    @Key("bootstrap-servers")
    @Default("localhost:9092")
    @NotBlank
    String getBootstrapServers();

    @Key("events-topic")
    @Default("sentinet.bridge.events")
    @NotBlank
    String getEventsTopic();

    @Key("commands-topic")
    @Default("sentinet.bridge.commands")
    @NotBlank
    String getCommandsTopic();

    @Key("group-id")
    @Default("sentinet-controller")
    String getGroupId();

    @Key("queue-capacity")
    @Default("1000")
    @Min(1)
    @Description("Outbound messages kept while the backend is slow or unreachable. The oldest message is dropped "
               + "on overflow.")
    int getQueueCapacity();

    @Key("command-queue-capacity")
    @Default("100")
    @Min(1)
    @Description("Operator commands received and not taken by the controller yet.")
    int getCommandQueueCapacity();

    @Key("max-retries")
    @Default("3")
    @Min(0)
    int getMaxRetries();

    @Key("retry-delay-ms")
    @Default("200")
    @Min(0)
    long getRetryDelayMs();

    @Key("max-retry-delay-ms")
    @Default("2000")
    @Min(0)
    long getMaxRetryDelayMs();

    @Key("command-poll-timeout-ms")
    @Default("50")
    @Min(1)
    long getCommandPollTimeoutMs();

    @Key("send-timeout-ms")
    @Default("5000")
    @Min(1)
    @Description("How long a single delivery attempt waits for the broker acknowledgement.")
    long getSendTimeoutMs();

    default Duration getRetryDelay() {
        return Duration.ofMillis(getRetryDelayMs());
    }

    default Duration getMaxRetryDelay() {
        return Duration.ofMillis(getMaxRetryDelayMs());
    }

    default Duration getCommandPollTimeout() {
        return Duration.ofMillis(getCommandPollTimeoutMs());
    }

    default Duration getSendTimeout() {
        return Duration.ofMillis(getSendTimeoutMs());
    }

    /**
     * Returns Kafka properties built with the configuration data for Producer.
     */
    default Properties createKafkaProducerProperties() {
        Properties properties = new Properties();
        properties.put("bootstrap.servers", getBootstrapServers());
        properties.put("acks", "all");
        properties.put("retries", 0);
        properties.put("linger.ms", 1);
        properties.put("max.block.ms", 1000);
        properties.put("key.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        properties.put("value.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        return properties;
    }

    /**
     * Returns Kafka properties built with the configuration data for Consumer.
     */
    default Properties createKafkaConsumerProperties() {
        Properties properties = new Properties();
        properties.put("bootstrap.servers", getBootstrapServers());
        properties.put("group.id", getGroupId());
        properties.put("session.timeout.ms", "30000");
        properties.put("enable.auto.commit", "true");
        properties.put("auto.offset.reset", "latest");
        properties.put("key.deserializer", "org.apache.kafka.common.serialization.StringDeserializer");
        properties.put("value.deserializer", "org.apache.kafka.common.serialization.StringDeserializer");
        return properties;
    }
}
