package com.critfumble.fumblebot.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Behavior of voice sessions: how the bot is addressed, what it says on its own, and how much
 * transcript context it hands to the language model.
 */
@Validated
@ConfigurationProperties(prefix = "fumblebot.voice")
public class VoiceProperties {

    /** Names the bot answers to, lower case. The first entry is the canonical spelling. */
    @NotEmpty
    private List<String> botNames = new ArrayList<>(List.of("fumblebot", "fumble bot"));

    /** How the bot is named in transcripts and exports. */
    @NotBlank
    private String botDisplayName = "FumbleBot";

    /** Words that may precede a bot name in a wake phrase ("hey fumblebot"). */
    private List<String> wakePrefixes = new ArrayList<>(List.of("hey", "okay", "ok"));

    /**
     * Vocabulary hint handed to the transcription provider. Must not contain the wake phrase itself:
     * recognizers tend to hallucinate hint text during silence.
     */
    private String recognitionHint = "TTRPG game session, dice rolls, initiative, attack, damage, saving throw";

    /** Spoken as soon as a slow (model-backed) request is detected. */
    @NotBlank
    private String acknowledgmentCue = "Yes?";

    /** Spoken once when an assistant session starts listening. */
    @NotBlank
    private String readyCue = "Ready!";

    private boolean readyCueEnabled = true;

    /** Spoken when a goodbye command ends the session. */
    @NotBlank
    private String farewell = "Goodbye! Session ended.";

    /** Used when a greeting carries no model-suggested reply. */
    @NotBlank
    private String greetingFallback = "Hey! What can I do for you?";

    /** When set, sessions may only be started in this guild. */
    private String allowedGuildId;

    /** Number of recent transcript entries given to the intent model as context. */
    @Min(0)
    private int recentContextSize = 10;

    /** Minimum transcript entries before a session summary is requested on stop. */
    @Min(1)
    private int summaryMinEntries = 3;

    /** Entries used for the raw excerpt when summary generation fails. */
    @Min(1)
    private int summaryExcerptSize = 20;

    /** Addressed commands shorter than this are recorded but not dispatched. */
    @Min(0)
    private int minCommandLength = 2;

    /** Time zone used for timestamps in transcript exports. */
    @NotBlank
    private String exportTimeZone = "UTC";

    /** Dispatched commands kept for inspection across all guilds. */
    @Min(0)
    private int commandHistorySize = 50;

    public List<String> getBotNames() {
        return botNames;
    }

    public void setBotNames(List<String> botNames) {
        this.botNames = botNames;
    }

    public String getBotDisplayName() {
        return botDisplayName;
    }

    public void setBotDisplayName(String botDisplayName) {
        this.botDisplayName = botDisplayName;
    }

    public List<String> getWakePrefixes() {
        return wakePrefixes;
    }

    public void setWakePrefixes(List<String> wakePrefixes) {
        this.wakePrefixes = wakePrefixes;
    }

    public String getRecognitionHint() {
        return recognitionHint;
    }

    public void setRecognitionHint(String recognitionHint) {
        this.recognitionHint = recognitionHint;
    }

    public String getAcknowledgmentCue() {
        return acknowledgmentCue;
    }

    public void setAcknowledgmentCue(String acknowledgmentCue) {
        this.acknowledgmentCue = acknowledgmentCue;
    }

    public String getReadyCue() {
        return readyCue;
    }

    public void setReadyCue(String readyCue) {
        this.readyCue = readyCue;
    }

    public boolean isReadyCueEnabled() {
        return readyCueEnabled;
    }

    public void setReadyCueEnabled(boolean readyCueEnabled) {
        this.readyCueEnabled = readyCueEnabled;
    }

    public String getFarewell() {
        return farewell;
    }

    public void setFarewell(String farewell) {
        this.farewell = farewell;
    }

    public String getGreetingFallback() {
        return greetingFallback;
    }

    public void setGreetingFallback(String greetingFallback) {
        this.greetingFallback = greetingFallback;
    }

    public String getAllowedGuildId() {
        return allowedGuildId;
    }

    public void setAllowedGuildId(String allowedGuildId) {
        this.allowedGuildId = allowedGuildId;
    }

    public int getRecentContextSize() {
        return recentContextSize;
    }

    public void setRecentContextSize(int recentContextSize) {
        this.recentContextSize = recentContextSize;
    }

    public int getSummaryMinEntries() {
        return summaryMinEntries;
    }

    public void setSummaryMinEntries(int summaryMinEntries) {
        this.summaryMinEntries = summaryMinEntries;
    }

    public int getSummaryExcerptSize() {
        return summaryExcerptSize;
    }

    public void setSummaryExcerptSize(int summaryExcerptSize) {
        this.summaryExcerptSize = summaryExcerptSize;
    }

    public int getMinCommandLength() {
        return minCommandLength;
    }

    public void setMinCommandLength(int minCommandLength) {
        this.minCommandLength = minCommandLength;
    }

    public String getExportTimeZone() {
        return exportTimeZone;
    }

    public void setExportTimeZone(String exportTimeZone) {
        this.exportTimeZone = exportTimeZone;
    }

    public int getCommandHistorySize() {
        return commandHistorySize;
    }

    public void setCommandHistorySize(int commandHistorySize) {
        this.commandHistorySize = commandHistorySize;
    }

    /**
     * @return canonical bot name used in prompts and transcript entries
     */
    public String canonicalBotName() {
        return botNames.isEmpty() ? "fumblebot" : botNames.get(0);
    }
}
