package com.sanguo.engine.abilities;

import com.sanguo.engine.abilities.equipment.ArmorPiercingSwordAbility;
import com.sanguo.engine.abilities.equipment.CrossbowAbility;
import com.sanguo.engine.abilities.equipment.DefensiveHorseAbility;
import com.sanguo.engine.abilities.equipment.EightTrigramAbility;
import com.sanguo.engine.abilities.equipment.LongWeaponAbility;
import com.sanguo.engine.abilities.equipment.OffensiveHorseAbility;
import com.sanguo.engine.abilities.equipment.ShieldAbility;
import com.sanguo.engine.abilities.hero.ExtraDrawAbility;
import com.sanguo.engine.abilities.hero.PeerlessAbility;
import com.sanguo.engine.abilities.hero.RetaliationAbility;
import com.sanguo.engine.abilities.hero.RoyalGuardAbility;
import com.sanguo.engine.abilities.hero.TreacheryAbility;
import com.sanguo.engine.model.Card;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Maps ability ids, and equipment card definitions, to factories producing
 * fresh ability instances.
 */
public class AbilityRegistry {
    private final Map<String, Supplier<Ability>> heroAbilities = new HashMap<>();
    private final Map<String, Supplier<Ability>> equipmentAbilities = new HashMap<>();

    /**
     * Registry holding every built-in ability.
     */
    public static AbilityRegistry standard() {
        AbilityRegistry registry = new AbilityRegistry();
        registry.registerHeroAbility(ExtraDrawAbility.ID, ExtraDrawAbility::new);
        registry.registerHeroAbility(PeerlessAbility.ID, PeerlessAbility::new);
        registry.registerHeroAbility(RoyalGuardAbility.ID, RoyalGuardAbility::new);
        registry.registerHeroAbility(TreacheryAbility.ID, TreacheryAbility::new);
        registry.registerHeroAbility(RetaliationAbility.ID, RetaliationAbility::new);

        registry.registerEquipmentAbility(CrossbowAbility.ID, CrossbowAbility::new);
        registry.registerEquipmentAbility(ArmorPiercingSwordAbility.ID, ArmorPiercingSwordAbility::new);
        registry.registerEquipmentAbility("kirin_bow", () -> new LongWeaponAbility("kirin_bow", "Kirin Bow", 5));
        registry.registerEquipmentAbility("serpent_spear", () -> new LongWeaponAbility("serpent_spear", "Serpent Spear", 3));
        registry.registerEquipmentAbility(EightTrigramAbility.ID, EightTrigramAbility::new);
        registry.registerEquipmentAbility(ShieldAbility.ID, ShieldAbility::new);
        registry.registerEquipmentAbility("red_hare", () -> new OffensiveHorseAbility("red_hare", "Red Hare"));
        registry.registerEquipmentAbility("shadow_runner", () -> new DefensiveHorseAbility("shadow_runner", "Shadow Runner"));
        return registry;
    }

    public void registerHeroAbility(String abilityId, Supplier<Ability> factory) {
        heroAbilities.put(abilityId, factory);
    }

    /**
     * @param definitionId card definition id of the equipment
     */
    public void registerEquipmentAbility(String definitionId, Supplier<Ability> factory) {
        equipmentAbilities.put(definitionId, factory);
    }

    /**
     * Create a new instance of a hero ability.
     * @throws IllegalArgumentException if the id is unknown
     */
    public Ability createHeroAbility(String abilityId) {
        Supplier<Ability> factory = heroAbilities.get(abilityId);
        if (factory == null) {
            throw new IllegalArgumentException("Unknown ability: " + abilityId);
        }
        return factory.get();
    }

    /**
     * Create the ability an equipment card grants, if it grants one.
     * Horses without their own entry get the generic horse ability.
     */
    public Optional<Ability> createEquipmentAbility(Card card) {
        Supplier<Ability> factory = equipmentAbilities.get(card.definitionId());
        if (factory != null) {
            return Optional.of(factory.get());
        }
        return switch (card.subType()) {
            case OFFENSIVE_HORSE -> Optional.of(new OffensiveHorseAbility(card.definitionId(), card.name()));
            case DEFENSIVE_HORSE -> Optional.of(new DefensiveHorseAbility(card.definitionId(), card.name()));
            default -> Optional.empty();
        };
    }

    public boolean hasHeroAbility(String abilityId) {
        return heroAbilities.containsKey(abilityId);
    }

    public Set<String> heroAbilityIds() {
        return Set.copyOf(heroAbilities.keySet());
    }
}
