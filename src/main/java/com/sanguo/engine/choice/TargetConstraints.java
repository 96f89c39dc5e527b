package com.sanguo.engine.choice;

import java.util.List;

/**
 * Which seats may be chosen and how many.
 */
public record TargetConstraints(int minTargets, int maxTargets, List<Integer> allowedSeats) {
    public TargetConstraints {
        if (minTargets < 0 || maxTargets < minTargets) {
            throw new IllegalArgumentException("Invalid target bounds " + minTargets + ".." + maxTargets);
        }
        allowedSeats = List.copyOf(allowedSeats);
    }

    public static TargetConstraints single(List<Integer> allowedSeats) {
        return new TargetConstraints(1, 1, allowedSeats);
    }
}
