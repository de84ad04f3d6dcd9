package com.yerin.storyq.infra;

import com.yerin.storyq.service.JobQueueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class RetentionSweeper {

    private final JobQueueService queue;

    @Scheduled(fixedDelayString = "${storyq.retention.sweep-interval-millis:60000}")
    public void sweep() {
        try {
            int removed = queue.evictExpired();
            if (removed > 0) {
                log.info("[RetentionSweeper] evicted={}", removed);
            }
        } catch (RuntimeException e) {
            log.warn("[RetentionSweeper] sweep failed, err={}", e.toString());
        }
    }
}
