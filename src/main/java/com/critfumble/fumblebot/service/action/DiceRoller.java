package com.critfumble.fumblebot.service.action;

/**
 * Rolls dice notation.
 */
public interface DiceRoller {

    /**
     * @param expression notation such as {@code 2d6+3} or {@code d20}
     * @return roll outcome
     * @throws IllegalArgumentException if the expression is not valid notation or out of bounds
     */
    DiceRoll roll(String expression);
}
