package org.whiteelephant.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "presents")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Present {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private UUID gameId;

    @Column(nullable = false)
    private String name;

    // propriétaire actuel, null tant que personne ne l'a gardé
    private Long playerId;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }
}
