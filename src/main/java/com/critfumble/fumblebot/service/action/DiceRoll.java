package com.critfumble.fumblebot.service.action;

import java.util.List;

/**
 * Outcome of rolling one dice expression.
 *
 * @param expression normalized notation, e.g. {@code 2d6+3}
 * @param sides faces per die
 * @param rolls individual die values in roll order
 * @param modifier flat modifier, may be negative or zero
 * @param total sum of rolls plus modifier
 */
public record DiceRoll(String expression, int sides, List<Integer> rolls, int modifier, int total) {

    public DiceRoll {
        rolls = List.copyOf(rolls);
    }

    /**
     * @return true for a natural 20 on a single d20
     */
    public boolean isCritical() {
        return sides == 20 && rolls.size() == 1 && rolls.get(0) == 20;
    }

    /**
     * @return true for a natural 1 on a single d20
     */
    public boolean isFumble() {
        return sides == 20 && rolls.size() == 1 && rolls.get(0) == 1;
    }
}
