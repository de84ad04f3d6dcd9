package com.yerin.storyq.service;

import com.yerin.storyq.domain.Job;
import com.yerin.storyq.domain.JobStore;
import com.yerin.storyq.domain.QueueCounts;
import com.yerin.storyq.domain.ReplayResult;
import com.yerin.storyq.global.exception.AppException;
import com.yerin.storyq.global.exception.code.JobErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Slf4j
@Service
@RequiredArgsConstructor
public class AdminJobService {
    private final JobStore store;
    private final JobAuditLog auditLog;
    private final Clock clock;

    public Job replay(String jobId) {
        ReplayResult result = store.replay(jobId, clock.instant());
        switch (result) {
            case NOT_FOUND -> throw new AppException(JobErrorCode.JOB_NOT_FOUND);
            case NOT_FAILED -> throw new AppException(JobErrorCode.JOB_NOT_FAILED);
            case REQUEUED -> {
                // 재시작 : attempts 초기화 + 즉시 대기열 재적재
                auditLog.append(jobId, "REPLAYED", 0, null);
                log.info("[Admin] replayed jobId={}", jobId);
            }
        }
        return store.find(jobId)
                .orElseThrow(() -> new AppException(JobErrorCode.JOB_NOT_FOUND));
    }

    public QueueCounts counts() {
        return store.counts();
    }
}
