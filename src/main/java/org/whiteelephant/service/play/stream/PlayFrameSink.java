package org.whiteelephant.service.play.stream;

import org.whiteelephant.dto.PlayEventMessage;

import java.io.IOException;

/** Sortie d'une connexion de spectateur (SSE en production). */
public interface PlayFrameSink {

    void sendEvent(PlayEventMessage event) throws IOException;

    void sendHeartbeat() throws IOException;

    void complete();
}
