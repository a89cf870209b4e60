package com.essaycoach.errors;

/**
 * A prompt with the same identifier is already stored in the corpus
 */
public class DuplicatePromptIdException extends EssayCoachException {
    private final String promptId;

    public DuplicatePromptIdException(String promptId) {
        super("Prompt id already present in corpus: " + promptId);
        this.promptId = promptId;
    }

    public String getPromptId() {
        return promptId;
    }
}
