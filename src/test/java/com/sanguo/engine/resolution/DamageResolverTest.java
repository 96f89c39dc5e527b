package com.sanguo.engine.resolution;

import com.sanguo.engine.Fixtures;
import com.sanguo.engine.events.BeforeDamageEvent;
import com.sanguo.engine.events.DamageAppliedEvent;
import com.sanguo.engine.events.PlayerDiedEvent;
import com.sanguo.engine.events.SynchronousEventBus;
import com.sanguo.engine.logging.InMemoryLogSink;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DamageResolverTest {

    private Game game;
    private SynchronousEventBus bus;
    private InMemoryLogSink sink;
    private BasicResolutionStack stack;
    private ResolutionContext context;

    @BeforeEach
    void setUp() {
        game = Fixtures.game(
                new Player(0, "attacker", "wei", 4),
                new Player(1, "target", "shu", 4, 2));
        bus = new SynchronousEventBus();
        sink = new InMemoryLogSink();
        stack = new BasicResolutionStack();
        context = Fixtures.context(game, 0).stack(stack).eventBus(bus).logSink(sink).build();
    }

    private static DamageDescriptor lethal(int amount, boolean triggersDying) {
        return new DamageDescriptor(0, 1, amount, DamageType.NORMAL, "Test", null, true, triggersDying, null);
    }

    @Test
    void testHealthIsClampedAtZero() {
        List<PlayerDiedEvent> deaths = new ArrayList<>();
        bus.subscribe(PlayerDiedEvent.class, deaths::add);

        stack.push(new DamageResolver(), context.withPendingDamage(lethal(5, false)));
        stack.drain();

        Player target = game.getPlayer(1);
        assertEquals(0, target.getCurrentHealth(), "Health never drops below zero");
        assertFalse(target.isAlive(), "Damage that skips dying kills at zero health");
        assertEquals(1, deaths.size());
        assertEquals(0, deaths.get(0).killerSeat());
        assertEquals(1, sink.ofType("PlayerDied").size());
    }

    @Test
    void testNonLethalDamage() {
        game.getPlayer(1).setCurrentHealth(4);

        stack.push(new DamageResolver(), context.withPendingDamage(DamageDescriptor.of(0, 1, 1, "Slash", null)));
        stack.drain();

        assertEquals(3, game.getPlayer(1).getCurrentHealth());
        assertTrue(game.getPlayer(1).isAlive());
        assertEquals(List.of("damage"), stack.historyKinds());
        assertEquals(3, sink.ofType("DamageApplied").get(0).data().get("current_health"));
    }

    @Test
    void testZeroHealthPushesDying() {
        stack.push(new DamageResolver(), context.withPendingDamage(lethal(2, true)));
        stack.pop();

        assertFalse(stack.isEmpty(), "Dying is pushed when health reaches zero");
        assertTrue(game.getPlayer(1).isAlive(), "The player is not dead until dying resolves");
    }

    @Test
    void testDyingRunsForTheDamagedPlayer() {
        stack.push(new DamageResolver(), context.withPendingDamage(lethal(2, true)));
        stack.drain();

        assertEquals(List.of("damage", "dying", "response-window", "rescue-outcome"), stack.historyKinds());
        assertFalse(game.getPlayer(1).isAlive(), "Nobody offered a peach");
        assertTrue(game.getPlayer(0).isAlive(), "The attacker acted, but seat 1 was the one dying");
        assertEquals(0, sink.ofType("PlayerDied").get(0).data().get("killer"), "The killer comes from the damage");
        assertEquals(1, sink.ofType("DyingStart").get(0).data().get("seat"));
    }

    @Test
    void testMissingPendingDamageFails() {
        stack.push(new DamageResolver(), context);
        ResolutionResult result = stack.pop();

        assertFalse(result.success());
        assertEquals(ResolutionErrorCode.INVALID_STATE, result.errorCode());
        assertEquals(2, game.getPlayer(1).getCurrentHealth());
    }

    @Test
    void testAppliedEventCarriesHealthAndContext() {
        List<DamageAppliedEvent> applied = new ArrayList<>();
        bus.subscribe(DamageAppliedEvent.class, applied::add);
        DamageDescriptor damage = DamageDescriptor.of(0, 1, 1, "Slash", null);

        stack.push(new DamageResolver(), context.withPendingDamage(damage));
        stack.drain();

        assertEquals(1, applied.size());
        assertEquals(2, applied.get(0).previousHealth());
        assertEquals(1, applied.get(0).currentHealth());
        assertSame(damage, applied.get(0).context().getPendingDamage(), "Handlers see the damage being applied");
        assertSame(stack, applied.get(0).context().getStack(), "Handlers can push onto the same stack");
    }

    @Test
    void testPreventedDamage() {
        bus.subscribe(BeforeDamageEvent.class, e -> e.prevent("test_shield"));

        stack.push(new DamageResolver(), context.withPendingDamage(DamageDescriptor.of(0, 1, 1, "Slash", null)));
        stack.drain();

        assertEquals(2, game.getPlayer(1).getCurrentHealth(), "Prevented damage changes nothing");
        assertEquals(1, sink.ofType("DamagePrevented").size());
        assertTrue(sink.ofType("DamageApplied").isEmpty());
    }

    @Test
    void testUnpreventableDamageIgnoresPrevention() {
        bus.subscribe(BeforeDamageEvent.class, e -> e.prevent("test_shield"));
        DamageDescriptor damage = new DamageDescriptor(null, 1, 1, DamageType.NORMAL, "Lightning", null,
                false, true, null);

        stack.push(new DamageResolver(), context.withPendingDamage(damage));
        stack.drain();

        assertEquals(1, game.getPlayer(1).getCurrentHealth());
    }

    @Test
    void testRedirectedDamage() {
        DamageDescriptor damage = DamageDescriptor.of(1, 1, 1, "Slash", null).redirectTo(0);

        stack.push(new DamageResolver(), context.withPendingDamage(damage));
        stack.drain();

        assertEquals(3, game.getPlayer(0).getCurrentHealth(), "Redirected damage lands on the new seat");
        assertEquals(2, game.getPlayer(1).getCurrentHealth());
    }

    @Test
    void testDeadTargetFails() {
        game.getPlayer(1).setAlive(false);

        stack.push(new DamageResolver(), context.withPendingDamage(DamageDescriptor.of(0, 1, 1, "Slash", null)));
        ResolutionResult result = stack.pop();

        assertFalse(result.success());
        assertEquals(ResolutionErrorCode.TARGET_NOT_ALIVE, result.errorCode());
    }

    @Test
    void testUnknownTargetFails() {
        stack.push(new DamageResolver(), context.withPendingDamage(DamageDescriptor.of(0, 7, 1, "Slash", null)));
        ResolutionResult result = stack.pop();

        assertEquals(ResolutionErrorCode.INVALID_TARGET, result.errorCode());
    }

    @Test
    void testNegativeAmountRejected() {
        assertThrows(IllegalArgumentException.class, () -> DamageDescriptor.of(0, 1, -1, "Slash", null));
    }
}
