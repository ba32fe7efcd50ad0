package org.whiteelephant.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.whiteelephant.dto.GameStateSnapshot;
import org.whiteelephant.service.play.PlayConflictException;
import org.whiteelephant.service.play.PlayEventLog;
import org.whiteelephant.service.play.PlayNotFoundException;
import org.whiteelephant.service.play.store.GameSlot;
import org.whiteelephant.service.play.store.GameState;
import org.whiteelephant.service.play.store.GameStateStore;
import org.whiteelephant.service.play.store.PresentState;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GameplayServiceTest {

    @Mock
    private GameStateStore store;

    @Mock
    private PlayEventLog eventLog;

    @InjectMocks
    private GameplayService gameplay;

    private final UUID gameId = UUID.randomUUID();
    private final LocalDateTime t0 = LocalDateTime.of(2024, 12, 24, 20, 0);

    private GameState state(Long playerId, Long presentId) {
        return new GameState(gameId, playerId, presentId, t0, t0);
    }

    // --- start() ---

    @Test
    void start_shouldReturnSnapshot_whenNotStartedYet() {
        when(store.markStartedIfNotStarted(eq(gameId), any())).thenReturn(true);
        when(store.findGame(gameId)).thenReturn(Optional.of(state(null, null)));

        GameStateSnapshot snap = gameplay.start(gameId);

        assertThat(snap.getStartedAt()).isEqualTo(t0);
        assertThat(snap.getPlayerId()).isNull();
        assertThat(snap.getPresentId()).isNull();
        verifyNoInteractions(eventLog);
    }

    @Test
    void start_shouldReportNoTurn_evenIfRowHoldsARolledPlayer() {
        when(store.markStartedIfNotStarted(eq(gameId), any())).thenReturn(true);
        when(store.findGame(gameId)).thenReturn(Optional.of(state(2L, null)));

        GameStateSnapshot snap = gameplay.start(gameId);

        assertThat(snap.getStartedAt()).isEqualTo(t0);
        assertThat(snap.getUpdatedAt()).isEqualTo(t0);
        assertThat(snap.getPlayerId()).isNull();
        assertThat(snap.getPresentId()).isNull();
    }

    @Test
    void start_shouldConflict_whenAlreadyStarted() {
        when(store.markStartedIfNotStarted(eq(gameId), any())).thenReturn(false);
        when(store.findGame(gameId)).thenReturn(Optional.of(state(null, null)));

        assertThatThrownBy(() -> gameplay.start(gameId))
                .isInstanceOf(PlayConflictException.class);
    }

    @Test
    void start_shouldBeNotFound_whenGameMissing() {
        when(store.markStartedIfNotStarted(eq(gameId), any())).thenReturn(false);
        when(store.findGame(gameId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> gameplay.start(gameId))
                .isInstanceOf(PlayNotFoundException.class);
    }

    // --- reset() ---

    @Test
    void reset_shouldReleasePresentsAndDeleteHistory() {
        when(store.resetGame(eq(gameId), any())).thenReturn(true);
        when(store.releasePresents(eq(gameId), any())).thenReturn(3);
        when(eventLog.deleteAll(gameId)).thenReturn(7);
        when(store.findGame(gameId)).thenReturn(Optional.of(new GameState(gameId, null, null, null, t0)));

        GameStateSnapshot snap = gameplay.reset(gameId);

        assertThat(snap.getStartedAt()).isNull();
        assertThat(snap.getPlayerId()).isNull();
        verify(store).releasePresents(eq(gameId), any());
        verify(eventLog).deleteAll(gameId);
        verify(eventLog, never()).append(any(), anyLong(), any(), any(), any());
    }

    @Test
    void reset_shouldBeNotFound_whenGameMissing() {
        when(store.resetGame(eq(gameId), any())).thenReturn(false);

        assertThatThrownBy(() -> gameplay.reset(gameId))
                .isInstanceOf(PlayNotFoundException.class);
        verify(eventLog, never()).deleteAll(any());
    }

    // --- roll() ---

    @Test
    void roll_shouldAppendEventWithRolledPlayer() {
        when(store.rollPlayerIfEmpty(eq(gameId), any())).thenReturn(true);
        when(store.findGame(gameId)).thenReturn(Optional.of(state(11L, null)));

        GameStateSnapshot snap = gameplay.roll(gameId);

        assertThat(snap.getPlayerId()).isEqualTo(11L);
        verify(eventLog).append(gameId, 11L, null, null, null);
    }

    @Test
    void roll_shouldConflict_whenPlayerAlreadyActive() {
        when(store.rollPlayerIfEmpty(eq(gameId), any())).thenReturn(false);
        when(store.findGame(gameId)).thenReturn(Optional.of(state(11L, null)));

        assertThatThrownBy(() -> gameplay.roll(gameId))
                .isInstanceOf(PlayConflictException.class);
        verifyNoInteractions(eventLog);
    }

    @Test
    void roll_shouldBeNotFound_whenNoEligiblePlayerLeft() {
        // la garde passe mais le tirage ne trouve personne
        when(store.rollPlayerIfEmpty(eq(gameId), any())).thenReturn(true);
        when(store.findGame(gameId)).thenReturn(Optional.of(state(null, null)));

        assertThatThrownBy(() -> gameplay.roll(gameId))
                .isInstanceOf(PlayNotFoundException.class);
        verifyNoInteractions(eventLog);
    }

    // --- pick() ---

    @Test
    void pick_shouldSetPresentAndRecordCapturedPlayer() {
        when(store.findGame(gameId)).thenReturn(Optional.of(state(11L, null)), Optional.of(state(11L, 21L)));
        when(store.findPresent(21L)).thenReturn(Optional.of(new PresentState(21L, gameId, null)));
        when(store.setIfEmpty(eq(gameId), eq(GameSlot.PRESENT), eq(21L), any())).thenReturn(true);

        GameStateSnapshot snap = gameplay.pick(gameId, 21L);

        assertThat(snap.getPlayerId()).isEqualTo(11L);
        assertThat(snap.getPresentId()).isEqualTo(21L);
        verify(eventLog).append(gameId, 11L, 21L, null, null);
    }

    @Test
    void pick_shouldConflict_whenPresentAlreadyContested() {
        when(store.findGame(gameId)).thenReturn(Optional.of(state(11L, 22L)));
        when(store.findPresent(21L)).thenReturn(Optional.of(new PresentState(21L, gameId, null)));
        when(store.setIfEmpty(eq(gameId), eq(GameSlot.PRESENT), eq(21L), any())).thenReturn(false);

        assertThatThrownBy(() -> gameplay.pick(gameId, 21L))
                .isInstanceOf(PlayConflictException.class);
        verifyNoInteractions(eventLog);
    }

    @Test
    void pick_shouldConflict_whenPresentAlreadyOwned() {
        when(store.findGame(gameId)).thenReturn(Optional.of(state(11L, null)));
        when(store.findPresent(21L)).thenReturn(Optional.of(new PresentState(21L, gameId, 12L)));

        assertThatThrownBy(() -> gameplay.pick(gameId, 21L))
                .isInstanceOf(PlayConflictException.class)
                .hasMessageContaining("claimed");
        verify(store, never()).setIfEmpty(any(), any(), anyLong(), any());
    }

    @Test
    void pick_shouldConflict_whenNoTurnInProgress() {
        when(store.findGame(gameId)).thenReturn(Optional.of(state(null, null)));
        when(store.findPresent(21L)).thenReturn(Optional.of(new PresentState(21L, gameId, null)));

        assertThatThrownBy(() -> gameplay.pick(gameId, 21L))
                .isInstanceOf(PlayConflictException.class);
    }

    @Test
    void pick_shouldBeNotFound_whenPresentBelongsToAnotherGame() {
        when(store.findGame(gameId)).thenReturn(Optional.of(state(11L, null)));
        when(store.findPresent(21L)).thenReturn(Optional.of(new PresentState(21L, UUID.randomUUID(), null)));

        assertThatThrownBy(() -> gameplay.pick(gameId, 21L))
                .isInstanceOf(PlayNotFoundException.class);
    }

    // --- keep() ---

    @Test
    void keep_shouldGivePresentToPlayerAndEndTurn() {
        when(store.findGame(gameId)).thenReturn(Optional.of(state(11L, 21L)), Optional.of(state(null, null)));
        when(store.clearTurnIf(eq(gameId), eq(11L), eq(21L), any())).thenReturn(true);

        GameStateSnapshot snap = gameplay.keep(gameId);

        assertThat(snap.getPlayerId()).isNull();
        assertThat(snap.getPresentId()).isNull();
        InOrder order = inOrder(store, eventLog);
        order.verify(store).clearTurnIf(eq(gameId), eq(11L), eq(21L), any());
        order.verify(store).setPresentOwner(eq(21L), eq(11L), any());
        order.verify(eventLog).append(gameId, 11L, 21L, 11L, 21L);
    }

    @Test
    void keep_shouldConflict_whenNothingContested() {
        when(store.findGame(gameId)).thenReturn(Optional.of(state(11L, null)));

        assertThatThrownBy(() -> gameplay.keep(gameId))
                .isInstanceOf(PlayConflictException.class);
        verify(store, never()).setPresentOwner(anyLong(), any(), any());
    }

    @Test
    void keep_shouldConflict_whenTurnResolvedConcurrently() {
        when(store.findGame(gameId)).thenReturn(Optional.of(state(11L, 21L)));
        when(store.clearTurnIf(eq(gameId), eq(11L), eq(21L), any())).thenReturn(false);

        assertThatThrownBy(() -> gameplay.keep(gameId))
                .isInstanceOf(PlayConflictException.class);
        verify(store, never()).setPresentOwner(anyLong(), any(), any());
        verifyNoInteractions(eventLog);
    }

    // --- steal() ---

    @Test
    void steal_shouldSwapOwnershipAndRecordPreviousOwner() {
        // joueur 11 a révélé A=21 ; B=22 appartient au joueur 12
        when(store.findGame(gameId)).thenReturn(Optional.of(state(11L, 21L)), Optional.of(state(null, null)));
        when(store.findPresent(22L)).thenReturn(Optional.of(new PresentState(22L, gameId, 12L)));
        when(store.clearTurnIf(eq(gameId), eq(11L), eq(21L), any())).thenReturn(true);

        GameStateSnapshot snap = gameplay.steal(gameId, 22L);

        assertThat(snap.getPlayerId()).isNull();
        assertThat(snap.getPresentId()).isNull();
        verify(store).setPresentOwner(eq(22L), eq(11L), any());
        verify(store).setPresentOwner(eq(21L), eq(12L), any());
        verify(eventLog).append(gameId, 11L, 22L, 12L, 22L);
    }

    @Test
    void steal_shouldConflict_whenTargetUnclaimed() {
        when(store.findGame(gameId)).thenReturn(Optional.of(state(11L, 21L)));
        when(store.findPresent(22L)).thenReturn(Optional.of(new PresentState(22L, gameId, null)));

        assertThatThrownBy(() -> gameplay.steal(gameId, 22L))
                .isInstanceOf(PlayConflictException.class);
        verify(store, never()).clearTurnIf(any(), anyLong(), anyLong(), any());
    }

    @Test
    void steal_shouldConflict_whenTargetIsTheContestedPresent() {
        when(store.findGame(gameId)).thenReturn(Optional.of(state(11L, 21L)));
        when(store.findPresent(21L)).thenReturn(Optional.of(new PresentState(21L, gameId, null)));

        assertThatThrownBy(() -> gameplay.steal(gameId, 21L))
                .isInstanceOf(PlayConflictException.class);
    }

    @Test
    void steal_shouldBeNotFound_whenTargetUnknown() {
        when(store.findGame(gameId)).thenReturn(Optional.of(state(11L, 21L)));
        when(store.findPresent(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> gameplay.steal(gameId, 99L))
                .isInstanceOf(PlayNotFoundException.class);
    }

    @Test
    void steal_shouldConflict_whenNoTurnInProgress() {
        when(store.findGame(gameId)).thenReturn(Optional.of(state(null, null)));

        assertThatThrownBy(() -> gameplay.steal(gameId, 22L))
                .isInstanceOf(PlayConflictException.class);
        verify(store, never()).findPresent(anyLong());
    }
}
