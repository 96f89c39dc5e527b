package com.sanguo.engine.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Numeric rule defaults. Fields absent from a JSON file keep their defaults.
 */
public class EngineConfig {
    public static final String DEFAULT_RESOURCE = "engine-defaults.json";

    @JsonProperty("max_slashes_per_turn")
    private int maxSlashesPerTurn = 1;

    @JsonProperty("base_attack_distance")
    private int baseAttackDistance = 1;

    @JsonProperty("minimum_seat_distance")
    private int minimumSeatDistance = 1;

    @JsonProperty("base_draw_count")
    private int baseDrawCount = 2;

    @JsonProperty("initial_hand_size")
    private int initialHandSize = 4;

    @JsonProperty("slash_damage")
    private int slashDamage = 1;

    @JsonProperty("max_event_depth")
    private int maxEventDepth = 64;

    public EngineConfig() {
    }

    /**
     * Built-in defaults, without reading any resource.
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * Load configuration from a JSON file.
     */
    public static EngineConfig fromFile(String path) throws ConfigurationException {
        try {
            return fromJson(Files.readString(Path.of(path)));
        } catch (IOException e) {
            throw new ConfigurationException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load configuration from a classpath resource.
     */
    public static EngineConfig fromResource(String resourcePath) throws ConfigurationException {
        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new ConfigurationException("Resource not found: " + resourcePath);
            }
            return new ObjectMapper().readValue(is, EngineConfig.class).validated();
        } catch (IOException e) {
            throw new ConfigurationException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load configuration from a JSON string.
     */
    public static EngineConfig fromJson(String json) throws ConfigurationException {
        try {
            return new ObjectMapper().readValue(json, EngineConfig.class).validated();
        } catch (IOException e) {
            throw new ConfigurationException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private EngineConfig validated() throws ConfigurationException {
        if (maxSlashesPerTurn < 0 || baseAttackDistance < 1 || minimumSeatDistance < 1
                || baseDrawCount < 0 || initialHandSize < 0 || slashDamage < 0 || maxEventDepth < 1) {
            throw new ConfigurationException("Configuration values out of range: " + this);
        }
        return this;
    }

    public int getMaxSlashesPerTurn() {
        return maxSlashesPerTurn;
    }

    public void setMaxSlashesPerTurn(int maxSlashesPerTurn) {
        this.maxSlashesPerTurn = maxSlashesPerTurn;
    }

    public int getBaseAttackDistance() {
        return baseAttackDistance;
    }

    public void setBaseAttackDistance(int baseAttackDistance) {
        this.baseAttackDistance = baseAttackDistance;
    }

    public int getMinimumSeatDistance() {
        return minimumSeatDistance;
    }

    public void setMinimumSeatDistance(int minimumSeatDistance) {
        this.minimumSeatDistance = minimumSeatDistance;
    }

    public int getBaseDrawCount() {
        return baseDrawCount;
    }

    public void setBaseDrawCount(int baseDrawCount) {
        this.baseDrawCount = baseDrawCount;
    }

    public int getInitialHandSize() {
        return initialHandSize;
    }

    public void setInitialHandSize(int initialHandSize) {
        this.initialHandSize = initialHandSize;
    }

    public int getSlashDamage() {
        return slashDamage;
    }

    public void setSlashDamage(int slashDamage) {
        this.slashDamage = slashDamage;
    }

    public int getMaxEventDepth() {
        return maxEventDepth;
    }

    public void setMaxEventDepth(int maxEventDepth) {
        this.maxEventDepth = maxEventDepth;
    }

    @Override
    public String toString() {
        return "EngineConfig{maxSlashesPerTurn=" + maxSlashesPerTurn
                + ", baseAttackDistance=" + baseAttackDistance
                + ", minimumSeatDistance=" + minimumSeatDistance
                + ", baseDrawCount=" + baseDrawCount
                + ", initialHandSize=" + initialHandSize
                + ", slashDamage=" + slashDamage
                + ", maxEventDepth=" + maxEventDepth + "}";
    }
}
