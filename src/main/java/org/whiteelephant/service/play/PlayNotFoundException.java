package org.whiteelephant.service.play;

public class PlayNotFoundException extends RuntimeException {
    public PlayNotFoundException(String message) {
        super(message);
    }
}
