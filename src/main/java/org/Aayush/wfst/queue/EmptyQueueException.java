package org.Aayush.wfst.queue;

/**
 * Thrown when reading or removing the head of an empty {@link StateQueue}.
 */
public class EmptyQueueException extends IllegalStateException {
    public EmptyQueueException(String message) {
        super(message);
    }
}
