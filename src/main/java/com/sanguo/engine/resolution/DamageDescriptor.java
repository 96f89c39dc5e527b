package com.sanguo.engine.resolution;

import com.sanguo.engine.model.Card;

import java.util.Objects;

/**
 * A pending instance of damage.
 *
 * @param sourceSeat     seat dealing the damage, or null for sourceless damage
 * @param causingCard    card that caused it, may be null
 * @param redirectToSeat when set, the damage lands on this seat instead of the target
 */
public record DamageDescriptor(
    Integer sourceSeat,
    int targetSeat,
    int amount,
    DamageType type,
    String reason,
    Card causingCard,
    boolean preventable,
    boolean triggersDying,
    Integer redirectToSeat
) {
    public DamageDescriptor {
        if (amount < 0) {
            throw new IllegalArgumentException("Damage amount cannot be negative: " + amount);
        }
        Objects.requireNonNull(type, "type");
    }

    /**
     * Ordinary preventable damage that may put the target into dying.
     */
    public static DamageDescriptor of(Integer sourceSeat, int targetSeat, int amount, String reason, Card causingCard) {
        return new DamageDescriptor(sourceSeat, targetSeat, amount, DamageType.NORMAL, reason, causingCard,
                true, true, null);
    }

    /**
     * Seat that actually receives the damage.
     */
    public int effectiveTargetSeat() {
        return redirectToSeat != null ? redirectToSeat : targetSeat;
    }

    public DamageDescriptor redirectTo(int seat) {
        return new DamageDescriptor(sourceSeat, targetSeat, amount, type, reason, causingCard,
                preventable, triggersDying, seat);
    }
}
