package com.sanguo.engine.card;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sanguo.engine.model.Card;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Card definitions and the deck list, loaded from JSON.
 */
public class CardCatalog {
    public static final String DEFAULT_RESOURCE = "cards.json";

    private final Map<String, CardDefinition> definitions;
    private final List<DeckEntry> deck;

    record CatalogFile(
        @JsonProperty("definitions") List<CardDefinition> definitions,
        @JsonProperty("deck") List<DeckEntry> deck
    ) {
    }

    private CardCatalog(Map<String, CardDefinition> definitions, List<DeckEntry> deck) {
        this.definitions = definitions;
        this.deck = deck;
    }

    /**
     * Load the catalog from a JSON file.
     */
    public static CardCatalog fromFile(String path) throws CardCatalogException {
        try {
            String content = Files.readString(Path.of(path));
            return fromJson(content);
        } catch (IOException e) {
            throw new CardCatalogException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load the catalog from a classpath resource.
     */
    public static CardCatalog fromResource(String resourcePath) throws CardCatalogException {
        try (InputStream is = CardCatalog.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CardCatalogException("Resource not found: " + resourcePath);
            }
            return fromCatalogFile(new ObjectMapper().readValue(is, CatalogFile.class));
        } catch (IOException e) {
            throw new CardCatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load the catalog from a JSON string.
     */
    public static CardCatalog fromJson(String json) throws CardCatalogException {
        try {
            return fromCatalogFile(new ObjectMapper().readValue(json, CatalogFile.class));
        } catch (IOException e) {
            throw new CardCatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static CardCatalog fromCatalogFile(CatalogFile file) throws CardCatalogException {
        Map<String, CardDefinition> definitions = new LinkedHashMap<>();
        if (file.definitions() != null) {
            for (CardDefinition definition : file.definitions()) {
                if (definitions.put(definition.id(), definition) != null) {
                    throw new CardCatalogException("Duplicate card definition: " + definition.id());
                }
            }
        }
        List<DeckEntry> deck = file.deck() == null ? List.of() : List.copyOf(file.deck());
        for (DeckEntry entry : deck) {
            if (!definitions.containsKey(entry.definitionId())) {
                throw new CardCatalogException("Deck entry references unknown card: " + entry.definitionId());
            }
            if (entry.suit() == null || entry.rank() < 1 || entry.rank() > 13) {
                throw new CardCatalogException("Invalid suit or rank for deck entry " + entry.definitionId());
            }
        }
        return new CardCatalog(definitions, deck);
    }

    /**
     * Get a definition by id.
     * @throws CardCatalogException if the card is not found
     */
    public CardDefinition getDefinition(String id) throws CardCatalogException {
        CardDefinition definition = definitions.get(id);
        if (definition == null) {
            throw new CardCatalogException("Card not found: " + id);
        }
        return definition;
    }

    /**
     * Check if a definition exists.
     */
    public boolean hasDefinition(String id) {
        return definitions.containsKey(id);
    }

    /**
     * Get total number of definitions.
     */
    public int definitionCount() {
        return definitions.size();
    }

    public List<CardDefinition> getDefinitions() {
        return List.copyOf(definitions.values());
    }

    public List<DeckEntry> getDeckEntries() {
        return deck;
    }

    /**
     * Create one card instance per deck entry, with ids 1..n in deck order.
     */
    public List<Card> buildDeck() {
        List<Card> cards = new ArrayList<>(deck.size());
        int nextId = 1;
        for (DeckEntry entry : deck) {
            CardDefinition definition = definitions.get(entry.definitionId());
            cards.add(new Card(nextId++, definition.id(), definition.name(), entry.suit(), entry.rank(),
                    definition.cardType(), definition.subType()));
        }
        return cards;
    }
}
