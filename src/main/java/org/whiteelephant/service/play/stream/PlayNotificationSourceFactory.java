package org.whiteelephant.service.play.stream;

public interface PlayNotificationSourceFactory {

    PlayNotificationSource open() throws NotificationChannelException;

    // pour les logs
    String describe();
}
