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
import org.sentinet.controller.security.AlertPublisher;
import org.sentinet.controller.security.SecurityAlert;
import org.sentinet.controller.statistics.FlowRecord;
import org.sentinet.model.topology.Topology;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import net.jodah.failsafe.Failsafe;
import net.jodah.failsafe.FailsafeException;
import net.jodah.failsafe.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Non blocking front of the {@link BridgeTransport}. Callers only enqueue, a dedicated worker delivers messages
 * with bounded retries. A second worker polls operator commands into a local queue, so taking a command never waits
 * for the backend. When a queue is full the oldest entry is dropped.
 */
public class BridgeGateway implements AlertPublisher {
    private static final Logger logger = LoggerFactory.getLogger(BridgeGateway.class);

    private static final long WORKER_POLL_MS = 100;

    private final boolean enabled;
    private final BridgeConfig config;
    private final BridgeTransport transport;
    private final Clock clock;

    private final BlockingQueue<BridgeMessage> queue;
    private final BlockingQueue<PendingCommand> commands;
    private final RetryPolicy<Object> retryPolicy;

    private final AtomicBoolean topologyPublished = new AtomicBoolean(false);
    private final AtomicLong sentCount = new AtomicLong();
    private final AtomicLong droppedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    private volatile Thread worker;
    private volatile Thread commandWorker;

    /**
     * Gateway that discards every message, used when the bridge is disabled.
     */
    public static BridgeGateway disabled(Clock clock) {
        return new BridgeGateway(null, null, clock);
    }

    public BridgeGateway(BridgeConfig config, BridgeTransport transport, Clock clock) {
        this.enabled = config != null && config.isEnabled();
        this.config = config;
        this.transport = transport;
        this.clock = clock;
        this.queue = new ArrayBlockingQueue<>(enabled ? config.getQueueCapacity() : 1);
        this.commands = new ArrayBlockingQueue<>(enabled ? config.getCommandQueueCapacity() : 1);
        this.retryPolicy = enabled ? makeRetryPolicy(config) : null;
    }

    /**
     * Start the delivery and the command workers.
     */
    public synchronized void start() {
        if (!enabled || worker != null) {
            return;
        }
        worker = new Thread(this::deliveryLoop, "sentinet-bridge");
        worker.setDaemon(true);
        worker.start();
        commandWorker = new Thread(this::commandLoop, "sentinet-bridge-commands");
        commandWorker.setDaemon(true);
        commandWorker.start();
        logger.info("Bridge gateway started");
    }

    /**
     * Stop the workers and close the transport. Messages still queued are lost.
     */
    public synchronized void stop() {
        Thread current = worker;
        Thread currentCommandWorker = commandWorker;
        worker = null;
        commandWorker = null;
        halt(current);
        halt(currentCommandWorker);
        if (transport != null) {
            transport.close();
        }
        logger.info("Bridge gateway stopped, {} messages left in the queue", queue.size());
    }

    /**
     * Publish the topology. Only the first call has effect.
     */
    public void publishTopology(Topology topology) {
        if (topologyPublished.compareAndSet(false, true)) {
            enqueue(BridgeMessageType.TOPOLOGY, topology.getDescriptor());
        }
    }

    public void publishStats(String switchId, long dpid, List<FlowRecord> flows) {
        enqueue(BridgeMessageType.STATS_UPDATE, ImmutableMap.of(
                "switch_id", switchId,
                "dpid", dpid,
                "flows", flows));
    }

    @Override
    public void publishAlert(SecurityAlert alert) {
        enqueue(BridgeMessageType.SECURITY_ALERT, alert);
    }

    public void publishSwitchEvent(boolean connected, String switchId, long dpid) {
        enqueue(BridgeMessageType.SWITCH_EVENT, ImmutableMap.of(
                "event", connected ? "connected" : "disconnected",
                "switch_id", switchId,
                "dpid", dpid));
    }

    /**
     * Take the next operator command already received from the backend. Never blocks.
     */
    public Optional<PendingCommand> pollPendingCommand() {
        return Optional.ofNullable(commands.poll());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public BridgeStatus getStatus() {
        return BridgeStatus.builder()
                .enabled(enabled)
                .queueSize(queue.size())
                .sentCount(sentCount.get())
                .droppedCount(droppedCount.get())
                .failedCount(failedCount.get())
                .build();
    }

    /**
     * Deliver one queued message in the calling thread.
     *
     * @return false if the queue was empty.
     */
    @VisibleForTesting
    boolean deliverNext() {
        BridgeMessage message = queue.poll();
        if (message == null) {
            return false;
        }
        deliver(message);
        return true;
    }

    /**
     * Poll the transport once in the calling thread and queue the received command.
     *
     * @return false if the transport had no command or failed.
     */
    @VisibleForTesting
    boolean fetchCommand() {
        Optional<PendingCommand> command;
        try {
            command = transport.pollCommand();
        } catch (RuntimeException e) {
            logger.warn("Unable to poll pending commands: {}", e.getMessage());
            return false;
        }
        if (!command.isPresent()) {
            return false;
        }
        while (!commands.offer(command.get())) {
            PendingCommand dropped = commands.poll();
            if (dropped != null) {
                logger.warn("Command queue is full, dropped oldest {} command", dropped.getCommand());
            }
        }
        return true;
    }

    private void enqueue(BridgeMessageType type, Object data) {
        if (!enabled) {
            logger.trace("Bridge disabled, discard {} message", type);
            return;
        }

        BridgeMessage message = new BridgeMessage(type, clock.millis(), data);
        while (!queue.offer(message)) {
            BridgeMessage dropped = queue.poll();
            if (dropped != null) {
                droppedCount.incrementAndGet();
                logger.warn("Bridge queue is full, dropped oldest {} message", dropped.getType());
            }
        }
    }

    private void deliveryLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            try {
                BridgeMessage message = queue.poll(WORKER_POLL_MS, TimeUnit.MILLISECONDS);
                if (message != null) {
                    deliver(message);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void commandLoop() {
        long idleMs = config.getCommandPollTimeout().toMillis();
        while (!Thread.currentThread().isInterrupted()) {
            if (!fetchCommand()) {
                try {
                    TimeUnit.MILLISECONDS.sleep(idleMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    private static void halt(Thread thread) {
        if (thread == null) {
            return;
        }
        thread.interrupt();
        try {
            thread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void deliver(BridgeMessage message) {
        try {
            Failsafe.with(retryPolicy).run(() -> transport.send(message));
            sentCount.incrementAndGet();
        } catch (FailsafeException e) {
            failedCount.incrementAndGet();
            logger.warn("Drop {} message after {} retries: {}", message.getType(), config.getMaxRetries(),
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (RuntimeException e) {
            failedCount.incrementAndGet();
            logger.error("Drop {} message, transport failed", message.getType(), e);
        }
    }

    private static RetryPolicy<Object> makeRetryPolicy(BridgeConfig config) {
        RetryPolicy<Object> policy = new RetryPolicy<>()
                .handle(BridgeTransportException.class)
                .withMaxRetries(config.getMaxRetries())
                .onRetry(event -> logger.debug("Retry bridge delivery, attempt {}: {}",
                        event.getAttemptCount(), String.valueOf(event.getLastFailure())));

        long delay = config.getRetryDelay().toMillis();
        long maxDelay = config.getMaxRetryDelay().toMillis();
        if (delay > 0 && delay < maxDelay) {
            policy.withBackoff(delay, maxDelay, ChronoUnit.MILLIS);
        } else if (delay > 0) {
            policy.withDelay(config.getRetryDelay());
        }
        return policy;
    }
}
