package org.whiteelephant.service.play.store;

/** Colonnes de tour d'une partie qui ne s'écrivent que si elles sont vides. Le joueur passe par le tirage. */
public enum GameSlot {
    PRESENT
}
