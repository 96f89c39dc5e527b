package com.sanguo.engine.card;

import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.CardSubType;
import com.sanguo.engine.model.CardType;
import com.sanguo.engine.model.Suit;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CardCatalog.
 */
class CardCatalogTest {

    private static CardCatalog catalog;

    @BeforeAll
    static void loadCatalog() throws CardCatalogException {
        catalog = CardCatalog.fromResource(CardCatalog.DEFAULT_RESOURCE);
    }

    @Test
    void testLoadDefinitions() {
        assertTrue(catalog.definitionCount() > 0, "Should have loaded definitions");
        assertTrue(catalog.hasDefinition("slash"));
        assertFalse(catalog.hasDefinition("lightning"));
    }

    @Test
    void testGetSlash() throws CardCatalogException {
        CardDefinition slash = catalog.getDefinition("slash");

        assertEquals("Slash", slash.name());
        assertEquals(CardType.BASIC, slash.cardType());
        assertEquals(CardSubType.SLASH, slash.subType());
    }

    @Test
    void testGetEquipment() throws CardCatalogException {
        CardDefinition shield = catalog.getDefinition("renwang_shield");

        assertEquals(CardType.EQUIP, shield.cardType());
        assertEquals(CardSubType.ARMOR, shield.subType());
    }

    @Test
    void testCardNotFound() {
        assertThrows(CardCatalogException.class, () -> catalog.getDefinition("Nonexistent Card"));
    }

    @Test
    void testBuildDeck() {
        List<Card> deck = catalog.buildDeck();

        assertEquals(catalog.getDeckEntries().size(), deck.size());
        Set<Integer> ids = new HashSet<>();
        for (Card card : deck) {
            assertTrue(ids.add(card.id()), "Card ids must be unique");
        }
        assertEquals(1, deck.get(0).id(), "Ids start at one");
        assertTrue(deck.stream().anyMatch(c -> c.is(CardSubType.SLASH)));
        assertTrue(deck.stream().anyMatch(c -> c.is(CardSubType.DODGE)));
        assertTrue(deck.stream().anyMatch(c -> c.is(CardSubType.PEACH)));
    }

    @Test
    void testFromJson() throws CardCatalogException {
        String json = """
            {
              "definitions": [{"id": "slash", "name": "Slash", "card_type": "basic", "sub_type": "slash"}],
              "deck": [{"definition": "slash", "suit": "spade", "rank": 7}]
            }
            """;

        CardCatalog small = CardCatalog.fromJson(json);
        Card card = small.buildDeck().get(0);

        assertEquals(Suit.SPADE, card.suit());
        assertEquals(7, card.rank());
        assertTrue(card.isBlack());
    }

    @Test
    void testUnknownDeckReference() {
        String json = """
            {
              "definitions": [],
              "deck": [{"definition": "slash", "suit": "spade", "rank": 7}]
            }
            """;

        CardCatalogException ex = assertThrows(CardCatalogException.class, () -> CardCatalog.fromJson(json));
        assertTrue(ex.getMessage().contains("unknown card"));
    }

    @Test
    void testDuplicateDefinition() {
        String json = """
            {
              "definitions": [
                {"id": "slash", "name": "Slash", "card_type": "basic", "sub_type": "slash"},
                {"id": "slash", "name": "Slash", "card_type": "basic", "sub_type": "slash"}
              ],
              "deck": []
            }
            """;

        assertThrows(CardCatalogException.class, () -> CardCatalog.fromJson(json));
    }

    @Test
    void testInvalidRank() {
        String json = """
            {
              "definitions": [{"id": "slash", "name": "Slash", "card_type": "basic", "sub_type": "slash"}],
              "deck": [{"definition": "slash", "suit": "spade", "rank": 14}]
            }
            """;

        assertThrows(CardCatalogException.class, () -> CardCatalog.fromJson(json));
    }

    @Test
    void testMalformedJson() {
        assertThrows(CardCatalogException.class, () -> CardCatalog.fromJson("{not json"));
    }

    @Test
    void testMissingResource() {
        assertThrows(CardCatalogException.class, () -> CardCatalog.fromResource("missing-cards.json"));
    }
}
