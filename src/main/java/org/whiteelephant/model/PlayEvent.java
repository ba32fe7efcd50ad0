package org.whiteelephant.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Ligne du journal de jeu. Jamais modifiée ; seul un reset de la partie la supprime.
 * L'insertion déclenche la notification {@code play} côté PostgreSQL.
 */
@Entity
@Table(name = "play_events")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private UUID gameId;

    @Column(nullable = false, updatable = false)
    private Long playerId;

    @Column(updatable = false)
    private Long presentId;

    @Column(updatable = false)
    private Long fromPlayerId;

    @Column(updatable = false)
    private Long fromPresentId;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }
}
