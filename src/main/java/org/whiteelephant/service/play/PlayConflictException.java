package org.whiteelephant.service.play;

/** Une garde a échoué : l'état a été modifié par une autre action. L'appelant doit relire l'état. */
public class PlayConflictException extends IllegalStateException {
    public PlayConflictException(String message) {
        super(message);
    }
}
