package com.sanguo.engine.game;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sanguo.engine.card.CardCatalogException;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hero definitions loaded from JSON.
 */
public class HeroCatalog {
    public static final String DEFAULT_RESOURCE = "heroes.json";

    private final Map<String, HeroDefinition> heroes;

    private HeroCatalog(Map<String, HeroDefinition> heroes) {
        this.heroes = heroes;
    }

    /**
     * Load heroes from a classpath resource.
     */
    public static HeroCatalog fromResource(String resourcePath) throws CardCatalogException {
        try (InputStream is = HeroCatalog.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CardCatalogException("Resource not found: " + resourcePath);
            }
            return fromList(new ObjectMapper().readValue(is, new TypeReference<List<HeroDefinition>>() {}));
        } catch (IOException e) {
            throw new CardCatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load heroes from a JSON string.
     */
    public static HeroCatalog fromJson(String json) throws CardCatalogException {
        try {
            return fromList(new ObjectMapper().readValue(json, new TypeReference<List<HeroDefinition>>() {}));
        } catch (IOException e) {
            throw new CardCatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static HeroCatalog fromList(List<HeroDefinition> list) throws CardCatalogException {
        Map<String, HeroDefinition> heroes = new LinkedHashMap<>();
        for (HeroDefinition hero : list) {
            if (hero.maxHealth() <= 0) {
                throw new CardCatalogException("Hero " + hero.id() + " needs positive max health");
            }
            heroes.put(hero.id(), hero);
        }
        return new HeroCatalog(heroes);
    }

    /**
     * Get a hero by id.
     * @throws CardCatalogException if the hero is not found
     */
    public HeroDefinition getHero(String id) throws CardCatalogException {
        HeroDefinition hero = heroes.get(id);
        if (hero == null) {
            throw new CardCatalogException("Hero not found: " + id);
        }
        return hero;
    }

    public List<HeroDefinition> getHeroes() {
        return List.copyOf(heroes.values());
    }
}
