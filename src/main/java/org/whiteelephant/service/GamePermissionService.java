package org.whiteelephant.service;

import lombok.RequiredArgsConstructor;
import org.whiteelephant.repo.GameRepository;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Niveaux d'accès à une partie, lus dans la colonne {@code users} (identifiant → niveau).
 * Utilisé par les {@code @PreAuthorize} des contrôleurs.
 */
@Service("gamePermissionService")
@RequiredArgsConstructor
public class GamePermissionService {

    public static final long VIEW = 0x1;
    public static final long PLAY = 0x2;
    public static final long OWNER = 0xff;

    private final GameRepository gameRepo;

    @Transactional(readOnly = true)
    public long levelOf(UUID gameId, String userId) {
        if (gameId == null || userId == null) return 0L;
        return gameRepo.findById(gameId)
                .map(g -> g.getUsers() == null ? null : g.getUsers().get(userId))
                .orElse(0L);
    }

    public boolean canView(UUID gameId, Authentication authentication) {
        return hasAtLeast(gameId, authentication, VIEW);
    }

    public boolean canPlay(UUID gameId, Authentication authentication) {
        return hasAtLeast(gameId, authentication, PLAY);
    }

    public boolean isOwner(UUID gameId, Authentication authentication) {
        return hasAtLeast(gameId, authentication, OWNER);
    }

    private boolean hasAtLeast(UUID gameId, Authentication authentication, long required) {
        if (authentication == null || !authentication.isAuthenticated()) return false;
        return levelOf(gameId, authentication.getName()) >= required;
    }
}
