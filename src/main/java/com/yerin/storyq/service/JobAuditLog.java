package com.yerin.storyq.service;

import com.yerin.storyq.config.StoryqProperties;
import com.yerin.storyq.domain.JobEventLog;
import com.yerin.storyq.repository.JobEventLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 잡 상태 전이 이력. 큐 상태의 원본은 JobStore 이고, 이 로그는 감사용이다.
 * 기록 실패는 경고만 남기고 전이를 되돌리지 않는다.
 */
@Slf4j
@Component
public class JobAuditLog {

    private final JobEventLogRepository logRepository;
    private final String queueName;

    public JobAuditLog(JobEventLogRepository logRepository, StoryqProperties properties) {
        this.logRepository = logRepository;
        this.queueName = properties.getQueue().getName();
    }

    public void append(String jobId, String event, Integer attempt, String message) {
        try {
            logRepository.save(JobEventLog.builder()
                    .jobId(jobId)
                    .queueName(queueName)
                    .eventType(event)
                    .attempt(attempt)
                    .message(message)
                    .build());
        } catch (DataAccessException e) {
            log.warn("[AuditLog] write failed jobId={}, event={}, err={}", jobId, event, e.toString());
        }
    }

    public List<JobEventLog> history(String jobId) {
        return logRepository.findByJobIdOrderByTsAscIdAsc(jobId);
    }
}
