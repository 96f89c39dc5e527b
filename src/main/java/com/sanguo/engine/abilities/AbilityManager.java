package com.sanguo.engine.abilities;

import com.sanguo.engine.events.EventBus;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the abilities of every seat: creates them from the registry,
 * attaches them to the event bus and answers live ability queries.
 */
public class AbilityManager implements AbilityQueryService {
    private static final Logger log = LoggerFactory.getLogger(AbilityManager.class);

    private final AbilityRegistry registry;
    private final EventBus eventBus;
    private final Map<Integer, List<Ability>> abilitiesBySeat = new LinkedHashMap<>();
    // Equipment card id -> granted ability
    private final Map<Integer, Ability> equipmentAbilities = new HashMap<>();

    public AbilityManager(AbilityRegistry registry, EventBus eventBus) {
        this.registry = registry;
        this.eventBus = eventBus;
    }

    /**
     * Create and attach the listed hero abilities for a player.
     * @throws IllegalArgumentException if an id is unknown
     */
    public void loadHeroAbilities(Game game, Player player, List<String> abilityIds) {
        for (String abilityId : abilityIds) {
            addAbility(game, player, registry.createHeroAbility(abilityId));
        }
    }

    /**
     * Attach an ability to a player. It is consulted after the player's
     * earlier abilities.
     */
    public void addAbility(Game game, Player player, Ability ability) {
        ability.attach(game, player, eventBus);
        abilitiesBySeat.computeIfAbsent(player.getSeat(), s -> new ArrayList<>()).add(ability);
        log.debug("Seat {} gained ability {}", player.getSeat(), ability.id());
    }

    /**
     * Detach and forget an ability. Unknown abilities are ignored.
     */
    public void removeAbility(Game game, Player player, Ability ability) {
        List<Ability> owned = abilitiesBySeat.get(player.getSeat());
        if (owned != null && owned.remove(ability)) {
            log.debug("Seat {} lost ability {}", player.getSeat(), ability.id());
        }
        ability.detach(game, player, eventBus);
    }

    /**
     * Attach the ability granted by a newly equipped card, if any.
     */
    public Optional<Ability> addEquipmentAbility(Game game, Player player, Card card) {
        Optional<Ability> ability = registry.createEquipmentAbility(card);
        ability.ifPresent(a -> {
            addAbility(game, player, a);
            equipmentAbilities.put(card.id(), a);
        });
        return ability;
    }

    /**
     * Detach the ability granted by an equipment card leaving play.
     */
    public void removeEquipmentAbility(Game game, Player player, Card card) {
        Ability ability = equipmentAbilities.remove(card.id());
        if (ability != null) {
            removeAbility(game, player, ability);
        }
    }

    /**
     * Detach every ability of every seat.
     */
    public void detachAll(Game game) {
        for (Map.Entry<Integer, List<Ability>> entry : abilitiesBySeat.entrySet()) {
            Player player = game.getPlayer(entry.getKey());
            for (Ability ability : entry.getValue()) {
                ability.detach(game, player, eventBus);
            }
        }
        abilitiesBySeat.clear();
        equipmentAbilities.clear();
    }

    /**
     * All abilities of a player, active or not.
     */
    public List<Ability> abilitiesOf(Player player) {
        return List.copyOf(abilitiesBySeat.getOrDefault(player.getSeat(), List.of()));
    }

    @Override
    public List<Ability> activeAbilities(Game game, Player player) {
        return abilitiesBySeat.getOrDefault(player.getSeat(), List.of()).stream()
                .filter(a -> a.isActive(game, player))
                .toList();
    }

    public AbilityRegistry getRegistry() {
        return registry;
    }
}
