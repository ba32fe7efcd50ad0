package org.whiteelephant.service.play.store;

import java.util.UUID;

public record PresentState(long id, UUID gameId, Long ownerId) {

    public boolean isClaimed() {
        return ownerId != null;
    }
}
