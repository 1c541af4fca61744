package io.docmirror.standalone.notify;

/** Thrown when a lifecycle notification cannot be delivered. */
public class NotificationException extends Exception {

    private static final long serialVersionUID = 1L;

    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
