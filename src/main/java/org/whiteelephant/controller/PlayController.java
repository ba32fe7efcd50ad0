package org.whiteelephant.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.whiteelephant.dto.GameStateSnapshot;
import org.whiteelephant.dto.PlayRequest;
import org.whiteelephant.service.GamePermissionService;
import org.whiteelephant.service.GameplayService;
import org.whiteelephant.service.PlayAction;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/play")
@RequiredArgsConstructor
public class PlayController {

    private final GameplayService gameplay;
    private final GamePermissionService permissions;

    @Value("${app.play.reset-requires-owner:false}")
    private boolean resetRequiresOwner;

    // --------------------------------------------------------------------
    // POST /api/play/{gameId}?action=start|reset|roll|pick|keep|steal
    // pick / steal : body {"present_id": n}
    @PostMapping("/{gameId}")
    @PreAuthorize("@gamePermissionService.canPlay(#gameId, authentication)")
    public ResponseEntity<GameStateSnapshot> play(@PathVariable UUID gameId,
                                                  @RequestParam String action,
                                                  @Valid @RequestBody(required = false) PlayRequest body,
                                                  Authentication authentication) {
        PlayAction a = PlayAction.parse(action);
        if (a.needsPresent() && (body == null || body.getPresentId() == null)) {
            throw new IllegalArgumentException("present_id is required for " + action);
        }
        if (a == PlayAction.RESET && resetRequiresOwner && !permissions.isOwner(gameId, authentication)) {
            throw new AccessDeniedException("Only the game owner can reset");
        }

        GameStateSnapshot snapshot = switch (a) {
            case START -> gameplay.start(gameId);
            case RESET -> gameplay.reset(gameId);
            case ROLL -> gameplay.roll(gameId);
            case PICK -> gameplay.pick(gameId, body.getPresentId());
            case KEEP -> gameplay.keep(gameId);
            case STEAL -> gameplay.steal(gameId, body.getPresentId());
        };
        log.debug("{} on game {} by {}", a, gameId, authentication != null ? authentication.getName() : "?");
        return ResponseEntity.ok(snapshot);
    }
}
