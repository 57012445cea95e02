package github.sarthakdev143.reel_forge.model;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * Lifecycle state machine of one generation task.
 * <p>
 * Stages advance strictly in {@link GenerationStage} order. {@code failed} and {@code cancelled} are reachable from
 * every non-terminal status; terminal statuses reject any further mutation. Task-level fields are only written by
 * the stage coordinator; per-scene workers may replace their own scene record through {@link #updateScene}.
 */
public class GenerationTask {

    private final String id;
    private final String ownerId;
    private final String prompt;
    private final GenerationConfig config;
    private final Instant createdAt;
    private final StageWeightTable weights;
    private final Clock clock;
    private final Map<GenerationStage, Integer> stageProgress = new EnumMap<>(GenerationStage.class);
    private final List<Scene> scenes = new CopyOnWriteArrayList<>();

    private volatile TaskStatus status;
    private GenerationStage stage;
    private String message;
    private TaskError error;
    private TaskResult result;
    private PromptAnalysis promptAnalysis;
    private Instant updatedAt;

    private GenerationTask(
            String id,
            String ownerId,
            String prompt,
            GenerationConfig config,
            Instant createdAt,
            StageWeightTable weights,
            Clock clock) {
        this.id = id;
        this.ownerId = ownerId;
        this.prompt = prompt;
        this.config = config;
        this.createdAt = createdAt;
        this.weights = weights;
        this.clock = clock;
    }

    public static GenerationTask create(
            String ownerId,
            String prompt,
            GenerationConfig config,
            StageWeightTable weights,
            Clock clock) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt is required.");
        }
        Instant now = clock.instant();
        GenerationTask task = new GenerationTask(
                UUID.randomUUID().toString(),
                ownerId,
                prompt,
                config,
                now,
                weights,
                clock);
        task.status = TaskStatus.PENDING;
        task.message = "Task queued.";
        task.updatedAt = now;
        return task;
    }

    public static GenerationTask restore(GenerationTaskSnapshot snapshot, StageWeightTable weights, Clock clock) {
        GenerationTask task = new GenerationTask(
                snapshot.id(),
                snapshot.ownerId(),
                snapshot.prompt(),
                snapshot.config(),
                snapshot.createdAt(),
                weights,
                clock);
        task.status = snapshot.status();
        task.stage = snapshot.stage();
        snapshot.stageProgress().forEach((stageName, percent) ->
                task.stageProgress.put(GenerationStage.fromWireName(stageName), percent));
        task.message = snapshot.message();
        task.error = snapshot.error();
        task.result = snapshot.result();
        task.promptAnalysis = snapshot.promptAnalysis();
        task.scenes.addAll(snapshot.scenes());
        task.updatedAt = snapshot.updatedAt();
        return task;
    }

    public String id() {
        return id;
    }

    public String ownerId() {
        return ownerId;
    }

    public String prompt() {
        return prompt;
    }

    public GenerationConfig config() {
        return config;
    }

    public TaskStatus status() {
        return status;
    }

    public synchronized GenerationStage stage() {
        return stage;
    }

    public synchronized PromptAnalysis promptAnalysis() {
        return promptAnalysis;
    }

    public synchronized int stageProgress(GenerationStage target) {
        return stageProgress.getOrDefault(target, 0);
    }

    public synchronized int overallProgress() {
        if (status == TaskStatus.COMPLETED) {
            return 100;
        }
        return weights.overallProgress(stageProgress);
    }

    /**
     * Moves the task into {@code next}. The task must be pending (and {@code next} the first stage), or be in the
     * stage immediately preceding {@code next} with that stage reporting 100%.
     */
    public synchronized void enterStage(GenerationStage next) {
        requireLive("enter stage " + next.wireName());

        if (status == TaskStatus.PENDING) {
            if (next != GenerationStage.first()) {
                throw new IllegalStateException(
                        "Task " + id + " must start with " + GenerationStage.first().wireName() + ", not " + next.wireName());
            }
        } else {
            GenerationStage expectedNext = stage.next().orElse(null);
            if (expectedNext != next) {
                throw new IllegalStateException(
                        "Task " + id + " cannot move from " + stage.wireName() + " to " + next.wireName());
            }
            if (stageProgress.getOrDefault(stage, 0) < 100) {
                throw new IllegalStateException(
                        "Task " + id + " cannot leave " + stage.wireName() + " before it reports 100%");
            }
        }

        stage = next;
        status = TaskStatus.forStage(next);
        stageProgress.put(next, 0);
        touch();
    }

    /**
     * Raises the current stage's progress. Lower values are ignored so progress never regresses within a stage.
     *
     * @return whether the stored percentage changed
     */
    public synchronized boolean reportStageProgress(int percent) {
        requireLive("report progress");
        if (stage == null) {
            throw new IllegalStateException("Task " + id + " has not entered a stage yet");
        }

        int clamped = Math.max(0, Math.min(100, percent));
        int current = stageProgress.getOrDefault(stage, 0);
        if (clamped <= current) {
            return false;
        }
        stageProgress.put(stage, clamped);
        touch();
        return true;
    }

    public synchronized void updateMessage(String newMessage) {
        requireLive("update message");
        this.message = newMessage;
        touch();
    }

    public synchronized void recordPromptAnalysis(PromptAnalysis analysis) {
        requireLive("record prompt analysis");
        requireStage(GenerationStage.ANALYZING_PROMPT, "record prompt analysis");
        this.promptAnalysis = analysis;
        touch();
    }

    public synchronized void assignScenes(List<Scene> newScenes) {
        requireLive("assign scenes");
        requireStage(GenerationStage.GENERATING_SCENES, "assign scenes");
        if (!scenes.isEmpty()) {
            throw new IllegalStateException("Task " + id + " already has scenes");
        }
        for (int index = 0; index < newScenes.size(); index++) {
            if (newScenes.get(index).index() != index) {
                throw new IllegalArgumentException("Scene at position " + index + " has index " + newScenes.get(index).index());
            }
        }
        scenes.addAll(newScenes);
        touch();
    }

    /**
     * Atomically replaces one scene record. Safe to call concurrently for different scene indexes.
     */
    public Scene updateScene(int index, UnaryOperator<Scene> update) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Task " + id + " is " + status.wireName() + "; scenes can no longer change");
        }
        Scene updated = update.apply(scenes.get(index));
        if (updated.index() != index) {
            throw new IllegalArgumentException("Scene update must keep index " + index);
        }
        scenes.set(index, updated);
        return updated;
    }

    public List<Scene> scenes() {
        return List.copyOf(scenes);
    }

    public Scene scene(int index) {
        return scenes.get(index);
    }

    public synchronized void complete(TaskResult taskResult) {
        requireLive("complete");
        GenerationStage last = GenerationStage.values()[GenerationStage.values().length - 1];
        if (stage != last || stageProgress.getOrDefault(last, 0) < 100) {
            throw new IllegalStateException("Task " + id + " cannot complete before " + last.wireName() + " reports 100%");
        }
        this.result = taskResult;
        this.status = TaskStatus.COMPLETED;
        this.message = "Video generated successfully.";
        touch();
    }

    public synchronized void fail(GenerationStage failedStage, String failureMessage) {
        requireLive("fail");
        this.error = new TaskError(failedStage, failureMessage);
        this.status = TaskStatus.FAILED;
        this.message = failureMessage;
        touch();
    }

    /**
     * @return {@code false} when the task was already terminal
     */
    public synchronized boolean cancel() {
        if (status.isTerminal()) {
            return false;
        }
        this.status = TaskStatus.CANCELLED;
        this.message = "Task cancelled.";
        touch();
        return true;
    }

    public synchronized GenerationTaskSnapshot snapshot() {
        Map<String, Integer> progressByStage = new LinkedHashMap<>();
        for (Map.Entry<GenerationStage, Integer> entry : stageProgress.entrySet()) {
            progressByStage.put(entry.getKey().wireName(), entry.getValue());
        }
        return new GenerationTaskSnapshot(
                id,
                ownerId,
                prompt,
                config,
                status,
                stage,
                progressByStage,
                overallProgress(),
                message,
                error,
                result,
                promptAnalysis,
                new ArrayList<>(scenes),
                createdAt,
                updatedAt);
    }

    private void requireLive(String action) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Task " + id + " is " + status.wireName() + "; cannot " + action);
        }
    }

    private void requireStage(GenerationStage expected, String action) {
        if (stage != expected) {
            throw new IllegalStateException("Task " + id + " must be in " + expected.wireName() + " to " + action);
        }
    }

    private void touch() {
        updatedAt = clock.instant();
    }
}
