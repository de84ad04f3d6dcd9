package com.yerin.storyq.generation;

import com.yerin.storyq.domain.StoryPayload;

/**
 * 외부 생성 API 호출. 지연 시간이 길고 가변적이다.
 * 오래 걸리는 구현은 중간중간 {@link GenerationContext#checkpoint()} 를 호출해 취소/타임아웃에 협조해야 한다.
 */
@FunctionalInterface
public interface StoryGenerator {

    String generate(StoryPayload payload, GenerationContext context) throws GenerationException;
}
