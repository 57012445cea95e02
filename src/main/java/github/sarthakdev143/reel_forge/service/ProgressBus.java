package github.sarthakdev143.reel_forge.service;

import github.sarthakdev143.reel_forge.config.ReelForgeProperties;
import github.sarthakdev143.reel_forge.model.GenerationTaskSnapshot;
import github.sarthakdev143.reel_forge.model.ProgressEvent;
import github.sarthakdev143.reel_forge.repository.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of progress subscriptions and fan-out of task snapshots to them.
 * <p>
 * Subscriptions are keyed by task id or by owner id. Every delivery reads the task's current state through
 * {@link #getStatus}, the same call the pull endpoint uses. Delivery is best effort: a subscriber that is closed or
 * fails to receive is dropped. Per subscriber and task, an event whose overall progress is lower than one already
 * delivered is skipped.
 */
@Component
public class ProgressBus {

    private static final Logger logger = LoggerFactory.getLogger(ProgressBus.class);

    private final TaskStore taskStore;
    private final Clock clock;
    private final Duration idleTimeout;

    private final Map<String, Set<ProgressSubscriber>> taskSubscriptions = new ConcurrentHashMap<>();
    private final Map<String, Set<ProgressSubscriber>> userSubscriptions = new ConcurrentHashMap<>();
    private final Map<ProgressSubscriber, SubscriberState> subscribers = new ConcurrentHashMap<>();

    @Autowired
    public ProgressBus(TaskStore taskStore, Clock clock, ReelForgeProperties properties) {
        this(taskStore, clock, properties.progress().idleSubscriptionTimeout());
    }

    public ProgressBus(TaskStore taskStore, Clock clock, Duration idleTimeout) {
        this.taskStore = taskStore;
        this.clock = clock;
        this.idleTimeout = idleTimeout;
    }

    /**
     * Current snapshot of a task, live or terminal. Both push delivery and status pulls go through here.
     */
    public Optional<ProgressEvent> getStatus(String taskId) {
        return taskStore.find(taskId).map(ProgressEvent::from);
    }

    public void subscribeToTask(String taskId, ProgressSubscriber subscriber) {
        stateOf(subscriber).taskIds.add(taskId);
        taskSubscriptions.computeIfAbsent(taskId, key -> ConcurrentHashMap.newKeySet()).add(subscriber);
        logger.debug("Subscriber {} watching task {}", subscriber.id(), taskId);
    }

    public void subscribeToUser(String userId, ProgressSubscriber subscriber) {
        stateOf(subscriber).userIds.add(userId);
        userSubscriptions.computeIfAbsent(userId, key -> ConcurrentHashMap.newKeySet()).add(subscriber);
        logger.debug("Subscriber {} watching user {}", subscriber.id(), userId);
    }

    public void unsubscribeFromTask(String taskId, ProgressSubscriber subscriber) {
        removeFrom(taskSubscriptions, taskId, subscriber);
        SubscriberState state = subscribers.get(subscriber);
        if (state != null) {
            state.taskIds.remove(taskId);
        }
    }

    /**
     * Removes every subscription held by {@code subscriber}.
     */
    public void unsubscribe(ProgressSubscriber subscriber) {
        SubscriberState state = subscribers.remove(subscriber);
        if (state == null) {
            return;
        }
        for (String taskId : state.taskIds) {
            removeFrom(taskSubscriptions, taskId, subscriber);
        }
        for (String userId : state.userIds) {
            removeFrom(userSubscriptions, userId, subscriber);
        }
        logger.debug("Subscriber {} removed", subscriber.id());
    }

    /**
     * Marks inbound activity so the subscriber is not swept as idle.
     */
    public void touch(ProgressSubscriber subscriber) {
        SubscriberState state = subscribers.get(subscriber);
        if (state != null) {
            state.lastActivity = clock.instant();
        }
    }

    /**
     * Sends the task's current snapshot to everyone watching the task or its owner.
     */
    public void publish(String taskId) {
        Optional<GenerationTaskSnapshot> snapshot = taskStore.find(taskId);
        if (snapshot.isEmpty()) {
            logger.warn("Skipping publish for unknown task {}", taskId);
            return;
        }

        ProgressEvent event = ProgressEvent.from(snapshot.get());
        Set<ProgressSubscriber> recipients = new LinkedHashSet<>();
        recipients.addAll(taskSubscriptions.getOrDefault(taskId, Set.of()));
        if (snapshot.get().ownerId() != null) {
            recipients.addAll(userSubscriptions.getOrDefault(snapshot.get().ownerId(), Set.of()));
        }
        for (ProgressSubscriber subscriber : recipients) {
            deliver(subscriber, event);
        }
    }

    /**
     * Sends one event to one subscriber, e.g. the resync snapshot right after subscribing.
     */
    public boolean deliver(ProgressSubscriber subscriber, ProgressEvent event) {
        if (!subscriber.isOpen()) {
            logger.warn("Dropping closed subscriber {}", subscriber.id());
            unsubscribe(subscriber);
            return false;
        }

        SubscriberState state = stateOf(subscriber);
        synchronized (state) {
            Integer lastDelivered = event.taskId() == null ? null : state.lastOverallProgress.get(event.taskId());
            if (lastDelivered != null && event.overallProgress() < lastDelivered) {
                return false;
            }
            try {
                subscriber.send(event);
            } catch (IOException | RuntimeException e) {
                logger.warn("Dropping subscriber {} after failed delivery: {}", subscriber.id(), e.getMessage());
                unsubscribe(subscriber);
                return false;
            }
            if (event.taskId() != null) {
                state.lastOverallProgress.put(event.taskId(), event.overallProgress());
            }
            state.lastActivity = clock.instant();
        }
        return true;
    }

    public ConnectionStats stats() {
        int taskSubscriptionCount = taskSubscriptions.values().stream().mapToInt(Set::size).sum();
        int userSubscriptionCount = userSubscriptions.values().stream().mapToInt(Set::size).sum();
        return new ConnectionStats(
                subscribers.size(),
                taskSubscriptions.size(),
                taskSubscriptionCount,
                userSubscriptions.size(),
                userSubscriptionCount);
    }

    /**
     * Closes and forgets subscribers with no activity within the idle timeout.
     *
     * @return how many subscribers were removed
     */
    @Scheduled(fixedDelayString = "${reel-forge.progress.idle-sweep-interval-ms:60000}")
    public int sweepIdleSubscribers() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        List<ProgressSubscriber> idle = new ArrayList<>();
        for (Map.Entry<ProgressSubscriber, SubscriberState> entry : subscribers.entrySet()) {
            if (entry.getValue().lastActivity.isBefore(cutoff) || !entry.getKey().isOpen()) {
                idle.add(entry.getKey());
            }
        }

        for (ProgressSubscriber subscriber : idle) {
            unsubscribe(subscriber);
            subscriber.close();
        }
        if (!idle.isEmpty()) {
            logger.info("Removed {} idle progress subscriber(s)", idle.size());
        }
        return idle.size();
    }

    private SubscriberState stateOf(ProgressSubscriber subscriber) {
        return subscribers.computeIfAbsent(subscriber, key -> new SubscriberState(clock.instant()));
    }

    private static void removeFrom(Map<String, Set<ProgressSubscriber>> index, String key, ProgressSubscriber subscriber) {
        index.computeIfPresent(key, (ignored, set) -> {
            set.remove(subscriber);
            return set.isEmpty() ? null : set;
        });
    }

    private static final class SubscriberState {
        private final Set<String> taskIds = ConcurrentHashMap.newKeySet();
        private final Set<String> userIds = ConcurrentHashMap.newKeySet();
        private final Map<String, Integer> lastOverallProgress = new HashMap<>();
        private volatile Instant lastActivity;

        private SubscriberState(Instant createdAt) {
            this.lastActivity = createdAt;
        }
    }
}
