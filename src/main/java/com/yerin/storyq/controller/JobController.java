package com.yerin.storyq.controller;

import com.yerin.storyq.domain.CancelResult;
import com.yerin.storyq.dto.request.SubmitJobRequest;
import com.yerin.storyq.dto.response.JobEventResponse;
import com.yerin.storyq.dto.response.JobResponse;
import com.yerin.storyq.global.dto.DataResponse;
import com.yerin.storyq.service.JobQueueService;
import com.yerin.storyq.service.JobTracker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobQueueService queueService;
    private final JobTracker tracker;

    @Operation(summary = "스토리 생성 잡 등록")
    @PostMapping
    public ResponseEntity<DataResponse<Map<String, String>>> submit(@Valid @RequestBody SubmitJobRequest request) {
        String jobId = queueService.enqueue(request.payload(), request.toOptions());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(DataResponse.from(Map.of("jobId", jobId)));
    }

    @Operation(summary = "잡 상태 조회", description = "waitMillis 를 주면 종료 상태가 될 때까지 최대 그 시간만큼 기다린다.")
    @GetMapping("/{id}")
    public CompletableFuture<ResponseEntity<DataResponse<JobResponse>>> get(
            @PathVariable String id,
            @RequestParam(required = false)
            @Parameter(description = "완료 대기 시간(ms)", example = "10000")
            Long waitMillis) {
        Duration wait = waitMillis == null ? Duration.ZERO : Duration.ofMillis(Math.max(0, waitMillis));
        return tracker.awaitTerminal(id, wait)
                .thenApply(job -> ResponseEntity.ok(DataResponse.from(JobResponse.from(job))));
    }

    @Operation(summary = "잡 취소")
    @PostMapping("/{id}/cancel")
    public ResponseEntity<DataResponse<Map<String, String>>> cancel(@PathVariable String id) {
        CancelResult result = queueService.cancel(id);
        return ResponseEntity.ok(DataResponse.from(Map.of(
                "jobId", id,
                "outcome", result.name().toLowerCase(Locale.ROOT)
        )));
    }

    @Operation(summary = "잡 이력 조회")
    @GetMapping("/{id}/events")
    public ResponseEntity<DataResponse<List<JobEventResponse>>> events(@PathVariable String id) {
        List<JobEventResponse> events = tracker.history(id).stream()
                .map(JobEventResponse::from)
                .toList();
        return ResponseEntity.ok(DataResponse.from(events));
    }
}
