package com.yerin.storyq.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "job_event_log", indexes = {
        @Index(name = "idx_job_event_log_job_id", columnList = "job_id")
})
public class JobEventLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name="job_id", nullable=false, length=36)
    private String jobId;

    @Column(name="queue_name", nullable=false, length=100)
    private String queueName;

    @Column(name="event_type", nullable=false, length=50)
    private String eventType;

    @Column(name="attempt")
    private Integer attempt;

    @Column(columnDefinition = "text")
    private String message;

    @Column(name="ts", nullable=false)
    private Instant ts;

    @PrePersist void pre() { if (ts == null) ts = Instant.now(); }
}
