package com.eainde.patientqa.prompt;

/**
 * Size limits for prompt composition, all in characters.
 *
 * @param historyWindow    number of most recent messages carried into the prompt
 * @param chunkBudgetChars maximum total characters of retrieved text
 * @param maxPromptChars   hard ceiling for the whole payload
 */
public record ComposerSettings(int historyWindow, int chunkBudgetChars, int maxPromptChars) {

    public ComposerSettings {
        if (historyWindow < 0) throw new IllegalArgumentException("historyWindow must be >= 0");
        if (chunkBudgetChars < 0) throw new IllegalArgumentException("chunkBudgetChars must be >= 0");
        if (maxPromptChars <= 0) throw new IllegalArgumentException("maxPromptChars must be > 0");
    }
}
