package org.whiteelephant.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.whiteelephant.model.PlayEvent;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Événement tel que diffusé aux spectateurs. Même forme que le payload
 * {@code row_to_json} envoyé par le trigger PostgreSQL.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PlayEventMessage {
    private Long id;
    private UUID gameId;
    private Long playerId;
    private Long presentId;
    private Long fromPlayerId;
    private Long fromPresentId;
    private LocalDateTime createdAt;

    public static PlayEventMessage of(PlayEvent e) {
        return PlayEventMessage.builder()
                .id(e.getId())
                .gameId(e.getGameId())
                .playerId(e.getPlayerId())
                .presentId(e.getPresentId())
                .fromPlayerId(e.getFromPlayerId())
                .fromPresentId(e.getFromPresentId())
                .createdAt(e.getCreatedAt())
                .build();
    }

    /** id, game_id et player_id sont toujours présents dans une ligne valide. */
    public boolean isComplete() {
        return id != null && gameId != null && playerId != null;
    }
}
