package com.sanguo.engine.abilities;

/**
 * Marks abilities granted by armor, which armor-ignoring effects suppress.
 */
public interface ArmorAbility {
}
