package com.yerin.storyq.support;

import com.yerin.storyq.generation.StoryGenerator;
import com.yerin.storyq.generation.TerminalGenerationException;
import com.yerin.storyq.generation.TransientGenerationException;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

/**
 * 테스트용 생성기. prompt 내용으로 동작을 고른다.
 * <ul>
 *   <li>"terminal" 포함: 재시도 불가 실패</li>
 *   <li>"flaky" 포함: 첫 시도만 일시 실패</li>
 *   <li>"always-transient" 포함: 매번 일시 실패</li>
 *   <li>"slow" 포함: 취소될 때까지 대기</li>
 * </ul>
 */
@TestConfiguration
public class TestGeneratorConfig {

    @Bean
    public StoryGenerator testStoryGenerator() {
        return (payload, context) -> {
            String prompt = payload.prompt();
            if (prompt.contains("terminal")) {
                throw new TerminalGenerationException("simulated invalid request");
            }
            if (prompt.contains("always-transient")) {
                throw new TransientGenerationException("simulated rate limit");
            }
            if (prompt.contains("flaky") && context.getAttempt() == 1) {
                throw new TransientGenerationException("simulated upstream 503");
            }
            if (prompt.contains("slow")) {
                while (true) {
                    context.checkpoint();
                    try {
                        Thread.sleep(50);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
            return "Once upon a time: " + prompt;
        };
    }
}
