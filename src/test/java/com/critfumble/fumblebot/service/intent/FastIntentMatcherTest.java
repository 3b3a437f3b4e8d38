package com.critfumble.fumblebot.service.intent;

import com.critfumble.fumblebot.config.properties.VoiceProperties;
import com.critfumble.fumblebot.domain.Intent;
import com.critfumble.fumblebot.domain.IntentResult;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class FastIntentMatcherTest {

    private final FastIntentMatcher matcher = new FastIntentMatcher(new VoiceProperties());

    private Optional<IntentResult> match(String full, String command) {
        return matcher.match(full, command);
    }

    @Test
    void everyAddressedDiceExpressionMatchesDeterministically() {
        Random random = new Random(7);
        for (int i = 0; i < 500; i++) {
            int count = random.nextInt(10);
            int sides = 2 + random.nextInt(99);
            int modifier = random.nextInt(21) - 10;
            String expression = (count == 0 ? "" : String.valueOf(count)) + "d" + sides
                    + (modifier > 0 ? "+" + modifier : modifier < 0 ? String.valueOf(modifier) : "");
            String expected = (count == 0 ? "1" : String.valueOf(count)) + "d" + sides
                    + (modifier > 0 ? "+" + modifier : modifier < 0 ? String.valueOf(modifier) : "");
            String phrase = (i % 2 == 0 ? "hey fumblebot " : "can you roll ") + expression + " please";

            Optional<IntentResult> first = match(phrase, expression + " please");
            Optional<IntentResult> second = match(phrase, expression + " please");

            assertThat(first).as(phrase).isPresent();
            assertThat(first).isEqualTo(second);
            assertThat(first.get()).isInstanceOf(IntentResult.RollDice.class);
            assertThat(((IntentResult.RollDice) first.get()).expression()).as(phrase).isEqualTo(expected);
        }
    }

    @Test
    void diceWithoutBotNameOrRollWordIsNotMatched() {
        assertThat(match("my character has 2d6 damage", "")).isEmpty();
    }

    @Test
    void spokenModifiersAreNormalized() {
        IntentResult.RollDice plus = (IntentResult.RollDice) match("hey fumblebot roll 2d6 plus 3", "roll 2d6 plus 3")
                .orElseThrow();
        IntentResult.RollDice minus = (IntentResult.RollDice) match("fumblebot roll d20 minus 1", "roll d20 minus 1")
                .orElseThrow();

        assertThat(plus.expression()).isEqualTo("2d6+3");
        assertThat(minus.expression()).isEqualTo("1d20-1");
    }

    @Test
    void initiativeImpliesD20() {
        IntentResult.RollDice result = (IntentResult.RollDice) match("fumblebot roll initiative", "roll initiative")
                .orElseThrow();

        assertThat(result.expression()).isEqualTo("1d20");
        assertThat(result.label()).isEqualTo("Initiative");
    }

    @Test
    void initiativeWithExplicitDiceKeepsExpression() {
        IntentResult.RollDice result = (IntentResult.RollDice) match("fumblebot roll initiative d20+2",
                "roll initiative d20+2").orElseThrow();

        assertThat(result.expression()).isEqualTo("1d20+2");
        assertThat(result.label()).isEqualTo("Initiative");
    }

    @Test
    void goodbyeRequiresBotNameOrStopListening() {
        assertThat(match("hey fumblebot goodbye", "goodbye")).get()
                .extracting(IntentResult::intent).isEqualTo(Intent.GOODBYE);
        assertThat(match("okay you can stop listening now", "")).get()
                .extracting(IntentResult::intent).isEqualTo(Intent.GOODBYE);
        assertThat(match("goodbye", "")).isEmpty();
        assertThat(match("bye", "")).isEmpty();
    }

    @Test
    void stopPhrasesCountOnlyAsTheWholeCommandOrItsOpening() {
        assertThat(match("hey fumblebot, bye for now", "bye for now")).get()
                .extracting(IntentResult::intent).isEqualTo(Intent.GOODBYE);
        assertThat(match("fumblebot stop.", "stop.")).get()
                .extracting(IntentResult::intent).isEqualTo(Intent.GOODBYE);
        assertThat(match("goodbye fumblebot", "")).get()
                .extracting(IntentResult::intent).isEqualTo(Intent.GOODBYE);
    }

    @Test
    void questionsMentioningStopWordsAreNotGoodbye() {
        assertThat(match("hey fumblebot, does the shield spell stop magic missile?",
                "does the shield spell stop magic missile?")).isEmpty();
        assertThat(match("hey fumblebot, can my rogue leave combat without provoking?",
                "can my rogue leave combat without provoking?")).isEmpty();
        assertThat(match("fumblebot how do I say goodbye in elvish", "how do I say goodbye in elvish")).isEmpty();
    }

    @Test
    void shortGreetingNamingBotIsMatched() {
        assertThat(match("hello fumblebot", "")).get()
                .extracting(IntentResult::intent).isEqualTo(Intent.GREETING);
        assertThat(match("fumblebot hi there", "hi there")).get()
                .extracting(IntentResult::intent).isEqualTo(Intent.GREETING);
    }

    @Test
    void longUtteranceOpeningWithGreetingIsLeftToModel() {
        assertThat(match("fumblebot hello can you tell me how flanking works", "hello can you tell me how flanking works"))
                .isEmpty();
    }

    @Test
    void questionsAreLeftToModel() {
        assertThat(match("hey fumblebot what does the prone condition do", "what does the prone condition do"))
                .isEmpty();
    }

    @Test
    void normalizeDiceRewritesSpokenOperators() {
        assertThat(FastIntentMatcher.normalizeDice("3d8 plus 4")).isEqualTo("3d8+4");
        assertThat(FastIntentMatcher.normalizeDice("d6 + 2")).isEqualTo("d6+2");
        assertThat(FastIntentMatcher.normalizeDice("d12 minus 2")).isEqualTo("d12-2");
    }
}
