package com.sanguo.engine.game;

import com.sanguo.engine.card.CardCatalog;
import com.sanguo.engine.card.CardCatalogException;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.rng.GameRng;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the initial state of a game.
 */
public final class GameSetup {

    private GameSetup() {
        // Utility class - prevent instantiation
    }

    /**
     * Seat the players and shuffle the catalog's deck into the draw pile.
     * Hands are dealt by the engine.
     */
    public static Game createGame(List<PlayerSpec> specs, HeroCatalog heroes, CardCatalog catalog, long seed)
            throws CardCatalogException {
        if (specs.size() < 2) {
            throw new IllegalArgumentException("A game needs at least two players, got " + specs.size());
        }
        List<Player> players = new ArrayList<>();
        for (PlayerSpec spec : specs) {
            HeroDefinition hero = heroes.getHero(spec.heroId());
            Player player = new Player(spec.seat(), hero.id(), hero.faction(), hero.maxHealth());
            if (spec.lord()) {
                player.setFlag(Player.FLAG_LORD, true);
            }
            players.add(player);
        }

        GameRng rng = new GameRng(seed);
        Game game = new Game(players, rng);

        List<Card> deck = new ArrayList<>(catalog.buildDeck());
        rng.shuffle(deck);
        game.getDrawPile().addAll(deck);
        return game;
    }
}
