package com.critfumble.fumblebot.service.action;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rolls {@code NdS[+-M]} notation. Covers what the voice pipeline asks for; richer grammars
 * (keep-highest, exploding dice) belong to the bot's dice service.
 */
@Component
public class StandardDiceRoller implements DiceRoller {

    static final int MAX_DICE = 100;
    static final int MAX_SIDES = 1000;

    private static final Pattern NOTATION = Pattern.compile("^(\\d*)d(\\d+)(?:([+-])(\\d+))?$");

    private final Random random;

    public StandardDiceRoller() {
        this(null);
    }

    /**
     * @param random source of randomness; null uses {@link ThreadLocalRandom}
     */
    public StandardDiceRoller(Random random) {
        this.random = random;
    }

    @Override
    public DiceRoll roll(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("expression must not be null");
        }
        String normalized = expression.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
        Matcher m = NOTATION.matcher(normalized);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not valid dice notation: " + expression);
        }
        int count = m.group(1).isEmpty() ? 1 : Integer.parseInt(m.group(1));
        int sides = Integer.parseInt(m.group(2));
        int modifier = m.group(4) == null ? 0 : Integer.parseInt(m.group(4));
        if ("-".equals(m.group(3))) {
            modifier = -modifier;
        }
        if (count < 1 || count > MAX_DICE) {
            throw new IllegalArgumentException("Dice count must be between 1 and " + MAX_DICE);
        }
        if (sides < 2 || sides > MAX_SIDES) {
            throw new IllegalArgumentException("Die sides must be between 2 and " + MAX_SIDES);
        }

        List<Integer> rolls = new ArrayList<>(count);
        int total = modifier;
        for (int i = 0; i < count; i++) {
            int value = nextInt(sides) + 1;
            rolls.add(value);
            total += value;
        }
        String notation = count + "d" + sides + (modifier > 0 ? "+" + modifier : modifier < 0 ? String.valueOf(modifier) : "");
        return new DiceRoll(notation, sides, rolls, modifier, total);
    }

    private int nextInt(int bound) {
        return random != null ? random.nextInt(bound) : ThreadLocalRandom.current().nextInt(bound);
    }
}
