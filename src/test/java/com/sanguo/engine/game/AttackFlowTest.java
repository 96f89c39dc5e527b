package com.sanguo.engine.game;

import com.sanguo.engine.Fixtures;
import com.sanguo.engine.abilities.AbilityManager;
import com.sanguo.engine.abilities.equipment.ArmorPiercingSwordAbility;
import com.sanguo.engine.abilities.equipment.EightTrigramAbility;
import com.sanguo.engine.abilities.equipment.ShieldAbility;
import com.sanguo.engine.abilities.hero.PeerlessAbility;
import com.sanguo.engine.abilities.hero.RetaliationAbility;
import com.sanguo.engine.abilities.hero.RoyalGuardAbility;
import com.sanguo.engine.abilities.hero.TreacheryAbility;
import com.sanguo.engine.choice.ChoiceProvider;
import com.sanguo.engine.choice.ChoiceResult;
import com.sanguo.engine.events.AfterSlashDodgedEvent;
import com.sanguo.engine.events.PlayerDiedEvent;
import com.sanguo.engine.logging.InMemoryLogSink;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.CardSubType;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.model.Suit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end slash resolution through the engine, one scenario per test.
 */
class AttackFlowTest {

    private Player attacker;
    private Player defender;
    private Game game;
    private InMemoryLogSink sink;

    @BeforeEach
    void setUp() {
        attacker = new Player(0, "attacker", "qun", 4);
        defender = new Player(1, "defender", "wei", 4);
        game = Fixtures.game(attacker, defender);
        Fixtures.playPhaseFor(game, 0);
        sink = new InMemoryLogSink();
    }

    private GameEngine engine(ChoiceProvider provider) {
        return Fixtures.engine(game, provider, sink);
    }

    @Test
    void testUndodgedSlashDealsDamage() {
        attacker.getHand().add(Fixtures.slash(1));
        GameEngine engine = engine(Fixtures.passing());

        ActionOutcome outcome = engine.useCard(ChoiceResult.action(0, 1, 1));

        assertTrue(outcome.isSuccess());
        assertEquals(List.of("use-card", "attack", "response-window", "attack-outcome", "damage"), outcome.kinds());
        assertEquals(3, defender.getCurrentHealth());
        assertEquals(1, game.getDiscardPile().size(), "The slash is discarded once used");
        assertEquals(1, sink.ofType("SlashHit").size());
        assertEquals(1, game.getUsageThisTurn(0, CardSubType.SLASH));
    }

    @Test
    void testDodgedSlash() {
        attacker.getHand().add(Fixtures.slash(1));
        Card dodge = Fixtures.dodge(2);
        defender.getHand().add(dodge);
        GameEngine engine = engine(Fixtures.respondingSeats(1));
        List<AfterSlashDodgedEvent> dodged = new ArrayList<>();
        engine.getEventBus().subscribe(AfterSlashDodgedEvent.class, dodged::add);

        ActionOutcome outcome = engine.useCard(ChoiceResult.action(0, 1, 1));

        assertEquals(List.of("use-card", "attack", "response-window", "attack-outcome"), outcome.kinds());
        assertEquals(4, defender.getCurrentHealth());
        assertTrue(game.getDiscardPile().contains(dodge));
        assertEquals(1, dodged.size());
        assertEquals(1, dodged.get(0).defenderSeat());
    }

    @Test
    void testSecondSlashIsRejected() {
        attacker.getHand().add(Fixtures.slash(1));
        attacker.getHand().add(Fixtures.slash(2));
        GameEngine engine = engine(Fixtures.passing());

        engine.useCard(ChoiceResult.action(0, 1, 1));
        ActionOutcome second = engine.useCard(ChoiceResult.action(0, 2, 1));

        assertFalse(second.isSuccess());
        assertEquals("rules.validate.noSuchAction", second.result().messageKey());
        assertTrue(second.history().isEmpty());
        assertEquals(3, defender.getCurrentHealth());
    }

    @Test
    void testShieldNullifiesBlackSlash() {
        attacker.getHand().add(Fixtures.blackSlash(1));
        GameEngine engine = engine(Fixtures.passing());
        engine.getAbilityManager().addAbility(game, defender, new ShieldAbility());

        ActionOutcome outcome = engine.useCard(ChoiceResult.action(0, 1, 1));

        assertTrue(outcome.isSuccess());
        assertEquals(List.of("use-card", "attack"), outcome.kinds());
        assertEquals(4, defender.getCurrentHealth());
        assertEquals(ShieldAbility.ID, sink.ofType("SlashNullified").get(0).data().get("vetoed_by"));
    }

    @Test
    void testShieldIgnoresRedSlash() {
        attacker.getHand().add(Fixtures.slash(1));
        GameEngine engine = engine(Fixtures.passing());
        engine.getAbilityManager().addAbility(game, defender, new ShieldAbility());

        engine.useCard(ChoiceResult.action(0, 1, 1));

        assertEquals(3, defender.getCurrentHealth());
    }

    @Test
    void testArmorPiercingSwordBypassesShield() {
        attacker.getHand().add(Fixtures.blackSlash(1));
        GameEngine engine = engine(Fixtures.passing());
        engine.getAbilityManager().addAbility(game, defender, new ShieldAbility());
        engine.getAbilityManager().addAbility(game, attacker, new ArmorPiercingSwordAbility());

        ActionOutcome outcome = engine.useCard(ChoiceResult.action(0, 1, 1));

        assertEquals(List.of("use-card", "attack", "response-window", "attack-outcome", "damage"), outcome.kinds());
        assertEquals(3, defender.getCurrentHealth());
        assertTrue(sink.ofType("SlashNullified").isEmpty());
    }

    @Test
    void testEightTrigramJudgementDodges() {
        attacker.getHand().add(Fixtures.slash(1));
        game.getDrawPile().add(Fixtures.card(50, CardSubType.PEACH, Suit.HEART, 5));
        GameEngine engine = engine(Fixtures.passing());
        engine.getAbilityManager().addAbility(game, defender, new EightTrigramAbility());

        ActionOutcome outcome = engine.useCard(ChoiceResult.action(0, 1, 1));

        assertEquals(List.of("use-card", "attack", "dodge-provider-chain", "attack-outcome"), outcome.kinds());
        assertEquals(4, defender.getCurrentHealth());
        assertEquals(EightTrigramAbility.ID, sink.ofType("SlashDodged").get(0).data().get("evaded_by"));
        assertTrue(game.getDiscardPile().getCards().stream().anyMatch(c -> c.id() == 50),
                "The judgement card ends in the discard pile");
    }

    @Test
    void testFailedJudgementFallsBackToManualDodge() {
        attacker.getHand().add(Fixtures.slash(1));
        game.getDrawPile().add(Fixtures.card(50, CardSubType.SLASH, Suit.CLUB, 5));
        GameEngine engine = engine(Fixtures.passing());
        engine.getAbilityManager().addAbility(game, defender, new EightTrigramAbility());

        ActionOutcome outcome = engine.useCard(ChoiceResult.action(0, 1, 1));

        assertEquals(List.of("use-card", "attack", "dodge-provider-chain", "response-window", "attack-outcome", "damage"),
                outcome.kinds());
        assertEquals(3, defender.getCurrentHealth());
    }

    @Test
    void testPeerlessNeedsTwoDodges() {
        attacker.getHand().add(Fixtures.slash(1));
        Card dodge = Fixtures.dodge(2);
        defender.getHand().add(dodge);
        GameEngine engine = engine(Fixtures.respondingSeats(1));
        engine.getAbilityManager().addAbility(game, attacker, new PeerlessAbility());

        ActionOutcome outcome = engine.useCard(ChoiceResult.action(0, 1, 1));

        assertEquals(List.of("use-card", "attack", "response-window", "attack-outcome", "damage"), outcome.kinds());
        assertEquals(3, defender.getCurrentHealth(), "One dodge is not enough");
        assertTrue(game.getDiscardPile().contains(dodge), "The lone dodge is still spent");
    }

    @Test
    void testPeerlessDodgedWithTwo() {
        attacker.getHand().add(Fixtures.slash(1));
        defender.getHand().add(Fixtures.dodge(2));
        defender.getHand().add(Fixtures.dodge(3));
        GameEngine engine = engine(Fixtures.respondingSeats(1));
        engine.getAbilityManager().addAbility(game, attacker, new PeerlessAbility());

        engine.useCard(ChoiceResult.action(0, 1, 1));

        assertEquals(4, defender.getCurrentHealth());
        assertTrue(defender.getHand().isEmpty());
    }

    @Test
    void testTreacheryObtainsTheSlash() {
        Card slash = Fixtures.slash(1);
        attacker.getHand().add(slash);
        GameEngine engine = engine(Fixtures.passing());
        engine.getAbilityManager().addAbility(game, defender, new TreacheryAbility());

        engine.useCard(ChoiceResult.action(0, 1, 1));

        assertTrue(defender.getHand().contains(slash), "The damaged player takes the card that hurt them");
        assertFalse(game.getDiscardPile().contains(slash));
    }

    @Test
    void testRetaliationDamagesAttacker() {
        attacker.getHand().add(Fixtures.slash(1));
        game.getDrawPile().add(Fixtures.card(50, CardSubType.SLASH, Suit.SPADE, 5));
        GameEngine engine = engine(Fixtures.passing());
        engine.getAbilityManager().addAbility(game, defender, new RetaliationAbility());

        ActionOutcome outcome = engine.useCard(ChoiceResult.action(0, 1, 1));

        assertEquals(List.of("use-card", "attack", "response-window", "attack-outcome", "damage", "retaliation", "damage"),
                outcome.kinds());
        assertEquals(3, defender.getCurrentHealth());
        assertEquals(3, attacker.getCurrentHealth(), "A non-heart judgement hurts the attacker");
    }

    @Test
    void testRetaliationFailsOnHeart() {
        attacker.getHand().add(Fixtures.slash(1));
        game.getDrawPile().add(Fixtures.card(50, CardSubType.PEACH, Suit.HEART, 5));
        GameEngine engine = engine(Fixtures.passing());
        engine.getAbilityManager().addAbility(game, defender, new RetaliationAbility());

        ActionOutcome outcome = engine.useCard(ChoiceResult.action(0, 1, 1));

        assertEquals(List.of("use-card", "attack", "response-window", "attack-outcome", "damage", "retaliation"),
                outcome.kinds());
        assertEquals(4, attacker.getCurrentHealth());
    }

    @Test
    void testRescueFromDying() {
        Player wounded = new Player(1, "defender", "wei", 4, 1);
        game = Fixtures.game(attacker, wounded);
        Fixtures.playPhaseFor(game, 0);
        attacker.getHand().add(Fixtures.slash(1));
        wounded.getHand().add(Fixtures.peach(2));
        GameEngine engine = engine(Fixtures.respondingSeats(1));

        ActionOutcome outcome = engine.useCard(ChoiceResult.action(0, 1, 1));

        assertEquals(List.of("use-card", "attack", "response-window", "attack-outcome", "damage",
                "dying", "response-window", "rescue-outcome"), outcome.kinds());
        assertTrue(wounded.isAlive());
        assertEquals(1, wounded.getCurrentHealth());
        assertEquals(1, sink.ofType("PlayerRescued").size());
    }

    @Test
    void testDeathWithoutRescue() {
        Player wounded = new Player(1, "defender", "wei", 4, 1);
        game = Fixtures.game(attacker, wounded);
        Fixtures.playPhaseFor(game, 0);
        attacker.getHand().add(Fixtures.slash(1));
        GameEngine engine = engine(Fixtures.passing());
        List<PlayerDiedEvent> deaths = new ArrayList<>();
        engine.getEventBus().subscribe(PlayerDiedEvent.class, deaths::add);

        engine.useCard(ChoiceResult.action(0, 1, 1));

        assertFalse(wounded.isAlive());
        assertEquals(1, deaths.size());
        assertEquals(0, deaths.get(0).killerSeat(), "The attacker is credited with the kill");
        assertTrue(engine.isOver());
    }

    @Test
    void testRoyalGuardAllyDodges() {
        Player lord = new Player(1, "lord", "wei", 4);
        lord.setFlag(Player.FLAG_LORD, true);
        Player ally = new Player(2, "ally", "wei", 4);
        game = Fixtures.game(attacker, lord, ally);
        Fixtures.playPhaseFor(game, 0);
        attacker.getHand().add(Fixtures.slash(1));
        Card dodge = Fixtures.dodge(2);
        ally.getHand().add(dodge);
        GameEngine engine = engine(Fixtures.respondingSeats(2));
        engine.getAbilityManager().addAbility(game, lord, new RoyalGuardAbility());

        ActionOutcome outcome = engine.useCard(ChoiceResult.action(0, 1, 1));

        assertEquals(List.of("use-card", "attack", "dodge-provider-chain", "response-assistance", "response-window",
                "assistance-outcome", "attack-outcome"), outcome.kinds());
        assertEquals(4, lord.getCurrentHealth());
        assertTrue(ally.getHand().isEmpty(), "The ally spent the dodge");
        assertEquals(1, sink.ofType("AssistanceGiven").size());
    }

    @Test
    void testRoyalGuardFallsBackToLord() {
        Player lord = new Player(1, "lord", "wei", 4);
        lord.setFlag(Player.FLAG_LORD, true);
        Player ally = new Player(2, "ally", "wei", 4);
        game = Fixtures.game(attacker, lord, ally);
        Fixtures.playPhaseFor(game, 0);
        attacker.getHand().add(Fixtures.slash(1));
        ally.getHand().add(Fixtures.dodge(2));
        lord.getHand().add(Fixtures.dodge(3));
        GameEngine engine = engine(Fixtures.respondingSeats(1));
        engine.getAbilityManager().addAbility(game, lord, new RoyalGuardAbility());

        ActionOutcome outcome = engine.useCard(ChoiceResult.action(0, 1, 1));

        assertEquals(List.of("use-card", "attack", "dodge-provider-chain", "response-assistance", "response-window",
                "assistance-outcome", "dodge-provider-chain", "response-window", "attack-outcome"), outcome.kinds());
        assertEquals(4, lord.getCurrentHealth(), "The lord dodges after the ally declines");
        assertEquals(1, ally.getHand().size());
    }

    @Test
    void testRoyalGuardInactiveForNonLord() {
        Player ally = new Player(2, "ally", "wei", 4);
        game = Fixtures.game(attacker, defender, ally);
        Fixtures.playPhaseFor(game, 0);
        attacker.getHand().add(Fixtures.slash(1));
        ally.getHand().add(Fixtures.dodge(2));
        GameEngine engine = engine(Fixtures.respondingSeats(2));
        AbilityManager abilities = engine.getAbilityManager();
        abilities.addAbility(game, defender, new RoyalGuardAbility());

        ActionOutcome outcome = engine.useCard(ChoiceResult.action(0, 1, 1));

        assertEquals(List.of("use-card", "attack", "response-window", "attack-outcome", "damage"), outcome.kinds());
        assertEquals(3, defender.getCurrentHealth());
    }
}
