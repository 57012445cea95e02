package github.sarthakdev143.reel_forge.service;

import github.sarthakdev143.reel_forge.model.ProgressEvent;

import java.io.IOException;

/**
 * One observer channel registered with the {@link ProgressBus}.
 */
public interface ProgressSubscriber {

    String id();

    boolean isOpen();

    void send(ProgressEvent event) throws IOException;

    /**
     * Closes the underlying channel. Called when the bus drops an idle subscriber.
     */
    void close();
}
