package com.sanguo.engine.resolution;

import com.sanguo.engine.Fixtures;
import com.sanguo.engine.model.Game;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BasicResolutionStackTest {

    private BasicResolutionStack stack;
    private ResolutionContext context;

    @BeforeEach
    void setUp() {
        Game game = Fixtures.game(2);
        stack = new BasicResolutionStack();
        context = Fixtures.context(game, 0).stack(stack).build();
    }

    @Test
    void testLastPushedRunsFirst() {
        List<String> order = new ArrayList<>();
        stack.push(Resolver.of("a", ctx -> {
            order.add("a");
            return ResolutionResult.SUCCESS;
        }), context);
        stack.push(Resolver.of("b", ctx -> {
            order.add("b");
            return ResolutionResult.SUCCESS;
        }), context);

        stack.drain();

        assertEquals(List.of("b", "a"), order, "Resolvers run last-in first-out");
        assertEquals(List.of("b", "a"), stack.historyKinds());
    }

    @Test
    void testChildRunsBeforeEarlierSibling() {
        stack.push(Resolver.of("sibling", ctx -> ResolutionResult.SUCCESS), context);
        stack.push(Resolver.of("parent", ctx -> {
            ctx.getStack().push(Resolver.of("child", c -> ResolutionResult.SUCCESS), ctx);
            return ResolutionResult.SUCCESS;
        }), context);

        stack.drain();

        assertEquals(List.of("parent", "child", "sibling"), stack.historyKinds(),
                "A pushed resolver finishes before anything below it");
    }

    @Test
    void testHistoryRecordsSequenceAndOutcome() {
        stack.push(Resolver.of("fails", ctx -> ResolutionResult.failure(ResolutionErrorCode.INVALID_STATE, "x")),
                context);
        stack.push(Resolver.of("works", ctx -> ResolutionResult.SUCCESS), context);

        stack.drain();

        List<HistoryEntry> history = stack.history();
        assertEquals(new HistoryEntry(1, "works", true), history.get(0));
        assertEquals(new HistoryEntry(2, "fails", false), history.get(1));
    }

    @Test
    void testFailureDoesNotStopDrain() {
        stack.push(Resolver.of("after", ctx -> ResolutionResult.SUCCESS), context);
        stack.push(Resolver.of("fails", ctx -> ResolutionResult.failure(ResolutionErrorCode.INVALID_TARGET, "x")),
                context);

        stack.drain();

        assertTrue(stack.isEmpty());
        assertEquals(List.of("fails", "after"), stack.historyKinds());
    }

    @Test
    void testPopOnEmptyStackThrows() {
        assertThrows(IllegalStateException.class, () -> stack.pop());
    }

    @Test
    void testPushNullThrows() {
        assertThrows(IllegalArgumentException.class, () -> stack.push(null, context));
        assertThrows(IllegalArgumentException.class,
                () -> stack.push(Resolver.of("orphan", ctx -> ResolutionResult.SUCCESS), null));
    }

    @Test
    void testEachFrameRunsWithItsOwnContext() {
        Game game = context.getGame();
        DamageDescriptor damage = DamageDescriptor.of(0, 1, 1, "Slash", null);
        List<String> seen = new ArrayList<>();

        stack.push(Resolver.of("parent", ctx -> {
            ResolutionContext derived = ctx.withActingPlayer(game.getPlayer(1)).withPendingDamage(damage);
            ctx.getStack().push(Resolver.of("child", c -> {
                seen.add("child acting=" + c.getActingPlayer().getSeat() + " damage=" + c.getPendingDamage());
                return ResolutionResult.SUCCESS;
            }), derived);
            ctx.getStack().push(Resolver.of("sibling", c -> {
                seen.add("sibling acting=" + c.getActingPlayer().getSeat() + " damage=" + c.getPendingDamage());
                return ResolutionResult.SUCCESS;
            }), ctx);
            return ResolutionResult.SUCCESS;
        }), context);

        stack.drain();

        assertEquals(List.of("sibling acting=0 damage=null", "child acting=1 damage=" + damage), seen,
                "A derived context reaches only the frame it was pushed with");
    }

    @Test
    void testResolverExceptionStopsDrain() {
        stack.push(Resolver.of("never", ctx -> ResolutionResult.SUCCESS), context);
        stack.push(Resolver.of("throws", ctx -> {
            throw new IllegalStateException("fault");
        }), context);

        assertThrows(IllegalStateException.class, () -> stack.drain());
        assertFalse(stack.isEmpty(), "Remaining resolvers stay on the stack");
        assertTrue(stack.history().isEmpty(), "A resolver that threw is not recorded");
    }

    @Test
    void testFailureNeedsErrorCode() {
        assertThrows(IllegalArgumentException.class, () -> ResolutionResult.failure(null, "x"));
    }
}
