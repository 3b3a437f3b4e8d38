package com.critfumble.fumblebot.domain;

import java.util.Objects;

/**
 * Outcome of classifying one addressed utterance. Never persisted beyond handling that utterance.
 *
 * <p>The set of variants is closed. Consumers implement {@link Visitor}, so adding a variant breaks
 * every consumer at compile time instead of falling through a default branch.
 */
public sealed interface IntentResult {

    IntentReason reason();

    /**
     * @return true if the bot should produce a response
     */
    default boolean shouldRespond() {
        return true;
    }

    /**
     * @return the intent this variant represents, {@code null} for {@link NotForBot}
     */
    Intent intent();

    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive handler over all intent variants.
     */
    interface Visitor<R> {
        R notForBot(NotForBot result);

        R rollDice(RollDice result);

        R lookupRule(LookupRule result);

        R question(Question result);

        R greeting(Greeting result);

        R goodbye(Goodbye result);

        R searchMessages(SearchMessages result);

        R postToChannel(PostToChannel result);

        R other(Other result);
    }

    /** The utterance was not meant for the bot. */
    record NotForBot(IntentReason reason) implements IntentResult {
        public NotForBot {
            reason = reason == null ? IntentReason.NOT_FOR_BOT : reason;
        }

        public static NotForBot instance() {
            return new NotForBot(IntentReason.NOT_FOR_BOT);
        }

        @Override
        public boolean shouldRespond() {
            return false;
        }

        @Override
        public Intent intent() {
            return null;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.notForBot(this);
        }
    }

    /**
     * @param expression dice notation, e.g. {@code 2d6+3}
     * @param label optional label such as "Initiative"
     */
    record RollDice(IntentReason reason, String expression, String label) implements IntentResult {
        public RollDice {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public Intent intent() {
            return Intent.ROLL_DICE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.rollDice(this);
        }
    }

    record LookupRule(IntentReason reason, String request) implements IntentResult {
        @Override
        public Intent intent() {
            return Intent.LOOKUP_RULE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.lookupRule(this);
        }
    }

    record Question(IntentReason reason, String request) implements IntentResult {
        @Override
        public Intent intent() {
            return Intent.QUESTION;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.question(this);
        }
    }

    /**
     * @param suggestedResponse short reply proposed by the model, or {@code null}
     */
    record Greeting(IntentReason reason, String suggestedResponse) implements IntentResult {
        @Override
        public Intent intent() {
            return Intent.GREETING;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.greeting(this);
        }
    }

    record Goodbye(IntentReason reason) implements IntentResult {
        @Override
        public Intent intent() {
            return Intent.GOODBYE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.goodbye(this);
        }
    }

    record SearchMessages(IntentReason reason, String query) implements IntentResult {
        @Override
        public Intent intent() {
            return Intent.SEARCH_MESSAGES;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.searchMessages(this);
        }
    }

    /**
     * @param channelName target channel name as spoken (fuzzy-matched later)
     * @param content what to post; may itself be a request such as "session summary"
     */
    record PostToChannel(IntentReason reason, String channelName, String content) implements IntentResult {
        @Override
        public Intent intent() {
            return Intent.POST_TO_CHANNEL;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.postToChannel(this);
        }
    }

    /**
     * @param request free-text request to answer, or {@code null}
     * @param suggestedResponse short reply proposed by the model, or {@code null}
     */
    record Other(IntentReason reason, String request, String suggestedResponse) implements IntentResult {
        @Override
        public Intent intent() {
            return Intent.OTHER;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.other(this);
        }
    }
}
