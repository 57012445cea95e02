package github.sarthakdev143.reel_forge.controller;

import github.sarthakdev143.reel_forge.config.ReelForgeProperties;
import github.sarthakdev143.reel_forge.dto.GenerationRequest;
import github.sarthakdev143.reel_forge.dto.TaskSubmissionResponse;
import github.sarthakdev143.reel_forge.exception.TaskNotFoundException;
import github.sarthakdev143.reel_forge.model.GenerationConfig;
import github.sarthakdev143.reel_forge.model.GenerationTaskSnapshot;
import github.sarthakdev143.reel_forge.model.ProgressEvent;
import github.sarthakdev143.reel_forge.service.GenerationTaskService;
import github.sarthakdev143.reel_forge.service.ProgressBus;
import github.sarthakdev143.reel_forge.service.impl.GenerationRequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

@RestController
@RequestMapping("/api/generation")
public class GenerationController {

    private static final Logger logger = LoggerFactory.getLogger(GenerationController.class);

    private final GenerationTaskService generationTaskService;
    private final GenerationRequestValidator requestValidator;
    private final ProgressBus progressBus;
    private final Duration terminalCacheTtl;

    public GenerationController(
            GenerationTaskService generationTaskService,
            GenerationRequestValidator requestValidator,
            ProgressBus progressBus,
            ReelForgeProperties properties) {
        this.generationTaskService = generationTaskService;
        this.requestValidator = requestValidator;
        this.progressBus = progressBus;
        this.terminalCacheTtl = properties.progress().terminalCacheTtl();
    }

    @PostMapping("/tasks")
    public ResponseEntity<?> submit(
            @RequestHeader(value = "X-Owner-Id", required = false) String ownerIdHeader,
            @RequestBody GenerationRequest request) {
        try {
            String ownerId = requestValidator.validateOwnerId(ownerIdHeader);
            String prompt = requestValidator.validatePrompt(request);
            GenerationConfig config = requestValidator.toConfig(request);

            GenerationTaskSnapshot snapshot = generationTaskService.submit(ownerId, prompt, config);
            return ResponseEntity.accepted()
                    .body(new TaskSubmissionResponse(
                            snapshot.id(),
                            snapshot.status(),
                            "Generation task accepted. Poll /api/generation/tasks/{taskId} or subscribe on /ws/generation."));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Generation task submission failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to accept generation task. Please try again.");
        }
    }

    /**
     * Terminal snapshots may be cached by the client for the configured TTL; live ones must not be cached.
     */
    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<?> getStatus(@PathVariable String taskId) {
        return generationTaskService.getStatus(taskId)
                .<ResponseEntity<?>>map(event -> ResponseEntity.ok()
                        .cacheControl(cacheControlFor(event))
                        .body(event))
                .orElseGet(() -> notFound(taskId));
    }

    @GetMapping("/tasks/{taskId}/detail")
    public ResponseEntity<?> getDetail(@PathVariable String taskId) {
        return generationTaskService.getDetail(taskId)
                .<ResponseEntity<?>>map(snapshot -> ResponseEntity.ok()
                        .cacheControl(snapshot.status().isTerminal()
                                ? CacheControl.maxAge(terminalCacheTtl).cachePrivate()
                                : CacheControl.noStore())
                        .body(snapshot))
                .orElseGet(() -> notFound(taskId));
    }

    @GetMapping("/tasks")
    public ResponseEntity<?> listForOwner(@RequestParam("ownerId") String ownerId) {
        try {
            return ResponseEntity.ok()
                    .cacheControl(CacheControl.noStore())
                    .body(generationTaskService.listForOwner(requestValidator.validateOwnerId(ownerId)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        }
    }

    @PostMapping("/tasks/{taskId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String taskId) {
        try {
            return ResponseEntity.accepted().body(generationTaskService.cancel(taskId));
        } catch (TaskNotFoundException e) {
            return notFound(taskId);
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
        }
    }

    @GetMapping("/connections")
    public ResponseEntity<?> connections() {
        return ResponseEntity.ok(progressBus.stats());
    }

    private CacheControl cacheControlFor(ProgressEvent event) {
        if (event.status() != null && event.status().isTerminal()) {
            return CacheControl.maxAge(terminalCacheTtl).cachePrivate();
        }
        return CacheControl.noStore();
    }

    private static ResponseEntity<?> notFound(String taskId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Task not found for id: " + taskId);
    }
}
