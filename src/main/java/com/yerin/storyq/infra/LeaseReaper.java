package com.yerin.storyq.infra;

import com.yerin.storyq.service.JobQueueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class LeaseReaper {

    private final JobQueueService queue;

    @Scheduled(fixedDelayString = "${storyq.reaper.interval-millis:2000}")
    public void reap() {
        try {
            int handled = queue.reapExpired();
            if (handled > 0) {
                log.info("[LeaseReaper] reaped={} (ACTIVE past lease)", handled);
            }
        } catch (RuntimeException e) {
            log.warn("[LeaseReaper] sweep failed, err={}", e.toString());
        }
    }
}
