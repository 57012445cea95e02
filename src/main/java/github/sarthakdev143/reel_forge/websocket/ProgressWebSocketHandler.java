package github.sarthakdev143.reel_forge.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.reel_forge.dto.GenerationRequest;
import github.sarthakdev143.reel_forge.dto.PushInboundMessage;
import github.sarthakdev143.reel_forge.model.GenerationConfig;
import github.sarthakdev143.reel_forge.model.GenerationTaskSnapshot;
import github.sarthakdev143.reel_forge.model.ProgressEvent;
import github.sarthakdev143.reel_forge.model.TaskError;
import github.sarthakdev143.reel_forge.service.GenerationTaskService;
import github.sarthakdev143.reel_forge.service.ProgressBus;
import github.sarthakdev143.reel_forge.service.impl.GenerationRequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Push channel at {@code /ws/generation?ownerId=<id>}.
 * <p>
 * The session is subscribed to its owner's tasks on connect. A frame carrying {@code task_id} subscribes to that task
 * and answers with its current snapshot; a frame carrying only {@code prompt} submits a new task and subscribes to it.
 */
@Component
public class ProgressWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(ProgressWebSocketHandler.class);
    private static final int SEND_TIME_LIMIT_MILLIS = 10_000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private final ProgressBus progressBus;
    private final GenerationTaskService generationTaskService;
    private final GenerationRequestValidator requestValidator;
    private final ObjectMapper objectMapper;
    private final Map<String, WebSocketProgressSubscriber> subscribers = new ConcurrentHashMap<>();

    public ProgressWebSocketHandler(
            ProgressBus progressBus,
            GenerationTaskService generationTaskService,
            GenerationRequestValidator requestValidator,
            ObjectMapper objectMapper) {
        this.progressBus = progressBus;
        this.generationTaskService = generationTaskService;
        this.requestValidator = requestValidator;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String ownerId;
        try {
            ownerId = requestValidator.validateOwnerId(ownerIdOf(session.getUri()));
        } catch (IllegalArgumentException e) {
            session.close(CloseStatus.POLICY_VIOLATION.withReason(e.getMessage()));
            return;
        }

        WebSocketSession safeSession = new ConcurrentWebSocketSessionDecorator(
                session, SEND_TIME_LIMIT_MILLIS, SEND_BUFFER_LIMIT_BYTES);
        WebSocketProgressSubscriber subscriber = new WebSocketProgressSubscriber(safeSession, objectMapper, ownerId);
        subscribers.put(session.getId(), subscriber);
        progressBus.subscribeToUser(ownerId, subscriber);
        logger.info("Progress channel {} opened for owner {}", session.getId(), ownerId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketProgressSubscriber subscriber = subscribers.get(session.getId());
        if (subscriber == null) {
            return;
        }
        progressBus.touch(subscriber);

        PushInboundMessage inbound;
        try {
            inbound = objectMapper.readValue(message.getPayload(), PushInboundMessage.class);
        } catch (JsonProcessingException e) {
            sendError(subscriber, null, "Malformed message: expected JSON with prompt or task_id.");
            return;
        }

        if (inbound.taskId() != null && !inbound.taskId().isBlank()) {
            resubscribe(subscriber, inbound.taskId().trim());
        } else {
            submit(subscriber, inbound);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketProgressSubscriber subscriber = subscribers.remove(session.getId());
        if (subscriber != null) {
            progressBus.unsubscribe(subscriber);
            logger.info("Progress channel {} closed ({})", session.getId(), status.getCode());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.warn("Transport error on progress channel {}: {}", session.getId(), exception.getMessage());
    }

    int openChannels() {
        return subscribers.size();
    }

    private void resubscribe(WebSocketProgressSubscriber subscriber, String taskId) {
        progressBus.getStatus(taskId).ifPresentOrElse(
                event -> {
                    progressBus.subscribeToTask(taskId, subscriber);
                    progressBus.deliver(subscriber, event);
                },
                () -> progressBus.deliver(subscriber, ProgressEvent.notFound(taskId)));
    }

    private void submit(WebSocketProgressSubscriber subscriber, PushInboundMessage inbound) {
        GenerationRequest request = inbound.toGenerationRequest();
        GenerationTaskSnapshot snapshot;
        try {
            String prompt = requestValidator.validatePrompt(request);
            GenerationConfig config = requestValidator.toConfig(request);
            snapshot = generationTaskService.submit(subscriber.ownerId(), prompt, config);
        } catch (IllegalArgumentException e) {
            sendError(subscriber, null, "Invalid request: " + e.getMessage());
            return;
        }

        progressBus.subscribeToTask(snapshot.id(), subscriber);
        progressBus.getStatus(snapshot.id()).ifPresent(event -> progressBus.deliver(subscriber, event));
    }

    private void sendError(WebSocketProgressSubscriber subscriber, String taskId, String message) {
        progressBus.deliver(subscriber, new ProgressEvent(taskId, null, null, 0, 0, null, new TaskError(null, message), null));
    }

    static String ownerIdOf(URI uri) {
        if (uri == null) {
            return null;
        }
        return UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("ownerId");
    }
}
