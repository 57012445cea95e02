package github.sarthakdev143.reel_forge.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.reel_forge.model.ProgressEvent;
import github.sarthakdev143.reel_forge.service.ProgressSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * Sends progress events to one WebSocket session as JSON text frames.
 */
public class WebSocketProgressSubscriber implements ProgressSubscriber {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketProgressSubscriber.class);

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;
    private final String ownerId;

    /**
     * @param session a session safe for concurrent sends, e.g. wrapped in a
     *                {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}
     */
    public WebSocketProgressSubscriber(WebSocketSession session, ObjectMapper objectMapper, String ownerId) {
        this.session = session;
        this.objectMapper = objectMapper;
        this.ownerId = ownerId;
    }

    public String ownerId() {
        return ownerId;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(ProgressEvent event) throws IOException {
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
    }

    @Override
    public void close() {
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE.withReason("Idle"));
        } catch (IOException e) {
            logger.warn("Could not close idle WebSocket session {}", session.getId(), e);
        }
    }
}
