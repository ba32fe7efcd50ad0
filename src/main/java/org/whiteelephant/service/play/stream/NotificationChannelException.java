package org.whiteelephant.service.play.stream;

/** Le canal de notification du store est fermé ou inutilisable. */
public class NotificationChannelException extends Exception {
    public NotificationChannelException(String message) {
        super(message);
    }

    public NotificationChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
