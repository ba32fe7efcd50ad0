package org.whiteelephant.controller;

import lombok.RequiredArgsConstructor;
import org.whiteelephant.service.play.stream.PlayEventSseService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;

@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
public class GameStreamController {

    private final PlayEventSseService sseService;

    // GET /api/games/{gameId}/stream : événements de jeu en direct (pas d'historique)
    @GetMapping(value = "/{gameId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable UUID gameId) {
        return sseService.open(gameId);
    }
}
