package com.yerin.storyq.repository;

import com.yerin.storyq.domain.JobEventLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface JobEventLogRepository extends JpaRepository<JobEventLog, Long> {
    List<JobEventLog> findByJobIdOrderByTsAscIdAsc(String jobId);
}
