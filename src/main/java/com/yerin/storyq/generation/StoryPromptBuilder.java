package com.yerin.storyq.generation;

import com.yerin.storyq.domain.StoryPayload;

public final class StoryPromptBuilder {
    private StoryPromptBuilder() {}

    static final String SYSTEM_PROMPT =
            "You are a creative fiction writer. Write complete, original stories in plain prose. "
            + "Do not add commentary before or after the story.";

    public static String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public static String userPrompt(StoryPayload payload) {
        StringBuilder sb = new StringBuilder();
        sb.append("Write a story based on the following idea:\n").append(payload.prompt().trim()).append('\n');
        if (payload.title() != null && !payload.title().isBlank()) {
            sb.append("Title: ").append(payload.title().trim()).append('\n');
        }
        if (payload.genre() != null && !payload.genre().isBlank()) {
            sb.append("Genre: ").append(payload.genre().trim()).append('\n');
        }
        if (payload.tone() != null && !payload.tone().isBlank()) {
            sb.append("Tone: ").append(payload.tone().trim()).append('\n');
        }
        if (payload.targetWords() != null) {
            sb.append("Length: about ").append(payload.targetWords()).append(" words\n");
        }
        if (payload.chapters() != null && payload.chapters() > 1) {
            sb.append("Structure: ").append(payload.chapters()).append(" chapters with headings\n");
        }
        return sb.toString();
    }
}
