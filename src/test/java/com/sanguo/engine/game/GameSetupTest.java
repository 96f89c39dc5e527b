package com.sanguo.engine.game;

import com.sanguo.engine.abilities.AbilityRegistry;
import com.sanguo.engine.card.CardCatalog;
import com.sanguo.engine.card.CardCatalogException;
import com.sanguo.engine.config.EngineConfig;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GameSetupTest {

    private static HeroCatalog heroes;
    private static CardCatalog cards;

    @BeforeAll
    static void loadCatalogs() throws CardCatalogException {
        heroes = HeroCatalog.fromResource(HeroCatalog.DEFAULT_RESOURCE);
        cards = CardCatalog.fromResource(CardCatalog.DEFAULT_RESOURCE);
    }

    @Test
    void testHeroCatalog() throws CardCatalogException {
        HeroDefinition caoCao = heroes.getHero("cao_cao");

        assertEquals("wei", caoCao.faction());
        assertEquals(4, caoCao.maxHealth());
        assertEquals(List.of("treachery", "royal_guard"), caoCao.abilities());
        assertThrows(CardCatalogException.class, () -> heroes.getHero("nobody"));
    }

    @Test
    void testHeroNeedsPositiveHealth() {
        String json = "[{\"id\": \"ghost\", \"name\": \"Ghost\", \"faction\": \"qun\", \"max_health\": 0}]";

        assertThrows(CardCatalogException.class, () -> HeroCatalog.fromJson(json));
    }

    @Test
    void testCreateGame() throws CardCatalogException {
        Game game = GameSetup.createGame(
                List.of(new PlayerSpec(0, "cao_cao", true), PlayerSpec.of(1, "lu_bu")),
                heroes, cards, 42);

        assertEquals(2, game.getPlayers().size());
        Player lord = game.getPlayer(0);
        assertTrue(lord.isLord());
        assertEquals(4, lord.getCurrentHealth());
        assertFalse(game.getPlayer(1).isLord());
        assertEquals(cards.getDeckEntries().size(), game.getDrawPile().size(), "The whole deck starts in the draw pile");
        assertTrue(game.getDiscardPile().isEmpty());
    }

    @Test
    void testSameSeedSameDeckOrder() throws CardCatalogException {
        List<PlayerSpec> specs = List.of(PlayerSpec.of(0, "guan_yu"), PlayerSpec.of(1, "lu_bu"));

        List<Integer> first = GameSetup.createGame(specs, heroes, cards, 7).getDrawPile().getCards()
                .stream().map(Card::id).toList();
        List<Integer> second = GameSetup.createGame(specs, heroes, cards, 7).getDrawPile().getCards()
                .stream().map(Card::id).toList();

        assertEquals(first, second);
    }

    @Test
    void testNeedsTwoPlayers() {
        assertThrows(IllegalArgumentException.class,
                () -> GameSetup.createGame(List.of(PlayerSpec.of(0, "guan_yu")), heroes, cards, 1));
    }

    @Test
    void testUnknownHero() {
        assertThrows(CardCatalogException.class,
                () -> GameSetup.createGame(List.of(PlayerSpec.of(0, "guan_yu"), PlayerSpec.of(1, "nobody")),
                        heroes, cards, 1));
    }

    @Test
    void testStartDealsOpeningHands() throws Exception {
        Game game = GameSetup.createGame(List.of(PlayerSpec.of(0, "xiahou_dun"), PlayerSpec.of(1, "zhou_yu")),
                heroes, cards, 3);
        GameEngine engine = new GameEngine(game, EngineConfig.defaults(),
                AbilityRegistry.standard(), null, null);

        engine.start(heroes);

        assertEquals(4, game.getPlayer(0).getHand().size());
        assertEquals(4, game.getPlayer(1).getHand().size());
        assertEquals("retaliation", engine.getAbilityManager().abilitiesOf(game.getPlayer(0)).get(0).id());
    }
}
