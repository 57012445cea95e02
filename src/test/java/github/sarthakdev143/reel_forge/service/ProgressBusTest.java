package github.sarthakdev143.reel_forge.service;

import github.sarthakdev143.reel_forge.model.GenerationConfig;
import github.sarthakdev143.reel_forge.model.GenerationStage;
import github.sarthakdev143.reel_forge.model.GenerationTask;
import github.sarthakdev143.reel_forge.model.OutputPreset;
import github.sarthakdev143.reel_forge.model.ProgressEvent;
import github.sarthakdev143.reel_forge.model.StageWeightTable;
import github.sarthakdev143.reel_forge.model.TaskStatus;
import github.sarthakdev143.reel_forge.repository.InMemoryTaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressBusTest {

    private MutableClock clock;
    private InMemoryTaskStore taskStore;
    private ProgressBus progressBus;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        taskStore = new InMemoryTaskStore();
        progressBus = new ProgressBus(taskStore, clock, Duration.ofMinutes(10));
    }

    @Test
    void getStatusReturnsStoredSnapshot() {
        GenerationTask task = storedTask("owner-1");

        assertThat(progressBus.getStatus(task.id()))
                .hasValueSatisfying(event -> {
                    assertThat(event.taskId()).isEqualTo(task.id());
                    assertThat(event.status()).isEqualTo(TaskStatus.PENDING);
                    assertThat(event.overallProgress()).isZero();
                });
        assertThat(progressBus.getStatus("missing")).isEmpty();
    }

    @Test
    void publishReachesTaskAndOwnerSubscribers() {
        GenerationTask task = storedTask("owner-1");
        RecordingSubscriber taskWatcher = new RecordingSubscriber("task-watcher");
        RecordingSubscriber ownerWatcher = new RecordingSubscriber("owner-watcher");
        RecordingSubscriber otherOwner = new RecordingSubscriber("other-owner");
        progressBus.subscribeToTask(task.id(), taskWatcher);
        progressBus.subscribeToUser("owner-1", ownerWatcher);
        progressBus.subscribeToUser("owner-2", otherOwner);

        task.enterStage(GenerationStage.ANALYZING_PROMPT);
        taskStore.save(task.snapshot());
        progressBus.publish(task.id());

        assertThat(taskWatcher.received()).singleElement()
                .satisfies(event -> assertThat(event.status()).isEqualTo(TaskStatus.ANALYZING_PROMPT));
        assertThat(ownerWatcher.received()).hasSize(1);
        assertThat(otherOwner.received()).isEmpty();
    }

    @Test
    void subscriberWatchingTaskAndOwnerReceivesEachEventOnce() {
        GenerationTask task = storedTask("owner-1");
        RecordingSubscriber subscriber = new RecordingSubscriber("both");
        progressBus.subscribeToTask(task.id(), subscriber);
        progressBus.subscribeToUser("owner-1", subscriber);

        progressBus.publish(task.id());

        assertThat(subscriber.received()).hasSize(1);
    }

    @Test
    void skipsEventsWhoseOverallProgressRegresses() {
        RecordingSubscriber subscriber = new RecordingSubscriber("s1");
        ProgressEvent ahead = new ProgressEvent(
                "task-1", TaskStatus.GENERATING_IMAGES, GenerationStage.GENERATING_IMAGES, 50, 40, null, null, null);
        ProgressEvent stale = new ProgressEvent(
                "task-1", TaskStatus.GENERATING_SCENES, GenerationStage.GENERATING_SCENES, 100, 25, null, null, null);
        ProgressEvent otherTask = new ProgressEvent(
                "task-2", TaskStatus.ANALYZING_PROMPT, GenerationStage.ANALYZING_PROMPT, 10, 1, null, null, null);

        assertThat(progressBus.deliver(subscriber, ahead)).isTrue();
        assertThat(progressBus.deliver(subscriber, stale)).isFalse();
        assertThat(progressBus.deliver(subscriber, otherTask)).isTrue();

        assertThat(subscriber.received()).containsExactly(ahead, otherTask);
    }

    @Test
    void dropsClosedAndFailingSubscribers() {
        GenerationTask task = storedTask("owner-1");
        RecordingSubscriber closed = new RecordingSubscriber("closed");
        RecordingSubscriber failing = new RecordingSubscriber("failing");
        RecordingSubscriber healthy = new RecordingSubscriber("healthy");
        progressBus.subscribeToTask(task.id(), closed);
        progressBus.subscribeToTask(task.id(), failing);
        progressBus.subscribeToTask(task.id(), healthy);
        closed.disconnect();
        failing.failOnSend();

        progressBus.publish(task.id());

        assertThat(healthy.received()).hasSize(1);
        assertThat(progressBus.stats().subscribers()).isEqualTo(1);
        assertThat(progressBus.stats().taskSubscriptions()).isEqualTo(1);
    }

    @Test
    void statsCountSubscribersAndSubscriptions() {
        RecordingSubscriber first = new RecordingSubscriber("first");
        RecordingSubscriber second = new RecordingSubscriber("second");
        progressBus.subscribeToTask("task-1", first);
        progressBus.subscribeToTask("task-2", first);
        progressBus.subscribeToTask("task-1", second);
        progressBus.subscribeToUser("owner-1", second);

        ConnectionStats stats = progressBus.stats();

        assertThat(stats).isEqualTo(new ConnectionStats(2, 2, 3, 1, 1));

        progressBus.unsubscribeFromTask("task-1", first);
        progressBus.unsubscribe(second);

        assertThat(progressBus.stats()).isEqualTo(new ConnectionStats(1, 1, 1, 0, 0));
    }

    @Test
    void sweepRemovesOnlyIdleSubscribers() {
        RecordingSubscriber idle = new RecordingSubscriber("idle");
        RecordingSubscriber active = new RecordingSubscriber("active");
        progressBus.subscribeToUser("owner-1", idle);
        progressBus.subscribeToUser("owner-1", active);

        clock.advance(Duration.ofMinutes(8));
        progressBus.touch(active);
        clock.advance(Duration.ofMinutes(3));

        assertThat(progressBus.sweepIdleSubscribers()).isEqualTo(1);
        assertThat(idle.wasClosed()).isTrue();
        assertThat(active.wasClosed()).isFalse();
        assertThat(progressBus.stats().subscribers()).isEqualTo(1);
    }

    @Test
    void publishForUnknownTaskIsIgnored() {
        RecordingSubscriber subscriber = new RecordingSubscriber("s1");
        progressBus.subscribeToTask("missing", subscriber);

        progressBus.publish("missing");

        assertThat(subscriber.received()).isEmpty();
    }

    private GenerationTask storedTask(String ownerId) {
        GenerationTask task = GenerationTask.create(
                ownerId,
                "A drone shot of a coastline",
                new GenerationConfig(OutputPreset.PORTRAIT_9_16, 20, null),
                StageWeightTable.defaults(),
                clock);
        taskStore.save(task.snapshot());
        return task;
    }
}
