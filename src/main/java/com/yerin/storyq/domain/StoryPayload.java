package com.yerin.storyq.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 스토리 생성 요청 파라미터. 큐는 이 값을 JSON 문자열로만 다룬다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoryPayload(
        @NotBlank(message = "prompt 는 필수입니다.")
        @Size(max = 4000, message = "prompt 는 4000자를 넘을 수 없습니다.")
        String prompt,

        @Size(max = 200, message = "title 은 200자를 넘을 수 없습니다.")
        String title,

        @Size(max = 50, message = "genre 는 50자를 넘을 수 없습니다.")
        String genre,

        @Size(max = 50, message = "tone 은 50자를 넘을 수 없습니다.")
        String tone,

        @Min(value = 100, message = "targetWords 는 100 이상이어야 합니다.")
        @Max(value = 5000, message = "targetWords 는 5000 이하여야 합니다.")
        Integer targetWords,

        @Min(value = 1, message = "chapters 는 1 이상이어야 합니다.")
        @Max(value = 20, message = "chapters 는 20 이하여야 합니다.")
        Integer chapters
) {
    public static StoryPayload ofPrompt(String prompt) {
        return new StoryPayload(prompt, null, null, null, null, null);
    }
}
