package com.yerin.storyq.controller;

import com.yerin.storyq.config.StoryqProperties;
import com.yerin.storyq.dto.response.QueueMetricsResponse;
import com.yerin.storyq.global.dto.DataResponse;
import com.yerin.storyq.service.AdminJobService;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
@RequestMapping("/admin/metrics")
@RequiredArgsConstructor
public class AdminMetricsController {

    private final AdminJobService adminJobService;
    private final StoryqProperties properties;
    private final Clock clock;

    @GetMapping("/queue")
    public ResponseEntity<DataResponse<QueueMetricsResponse>> queue(@RequestHeader(value = "X-Admin-Token", required = true)
                                                                    @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                                    String adminToken) {
        QueueMetricsResponse body = QueueMetricsResponse.of(
                properties.getQueue().getName(), adminJobService.counts(), clock.instant());
        return ResponseEntity.ok(DataResponse.from(body));
    }
}
