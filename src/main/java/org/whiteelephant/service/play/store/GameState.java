package org.whiteelephant.service.play.store;

import java.time.LocalDateTime;
import java.util.UUID;

public record GameState(UUID id, Long playerId, Long presentId,
                        LocalDateTime startedAt, LocalDateTime updatedAt) {

    public boolean hasActiveTurn() {
        return playerId != null && presentId != null;
    }
}
