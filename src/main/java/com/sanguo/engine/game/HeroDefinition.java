package com.sanguo.engine.game;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A playable hero: faction, health and the abilities it starts with.
 */
public record HeroDefinition(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("faction") String faction,
    @JsonProperty("max_health") int maxHealth,
    @JsonProperty("abilities") List<String> abilities
) {
    public HeroDefinition {
        abilities = abilities == null ? List.of() : List.copyOf(abilities);
    }
}
