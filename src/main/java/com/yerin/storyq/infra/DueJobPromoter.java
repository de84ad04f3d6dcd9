package com.yerin.storyq.infra;

import com.yerin.storyq.service.JobQueueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 지연/재시도 대기 잡 중 delayUntil 이 지난 것을 대기열로 옮긴다.
 * 워커의 claim 도 같은 승격을 하므로 이 작업은 유휴 구간의 보조 역할이다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DueJobPromoter {

    private final JobQueueService queue;

    @Scheduled(fixedDelayString = "${storyq.promoter.interval-millis:1000}")
    public void promoteDue() {
        try {
            int moved = queue.promoteDue();
            if (moved > 0) {
                log.debug("[DueJobPromoter] promoted={}", moved);
            }
        } catch (RuntimeException e) {
            log.warn("[DueJobPromoter] promote fail, err={}", e.toString());
        }
    }
}
