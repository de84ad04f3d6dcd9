package com.yerin.storyq.web;

import com.yerin.storyq.config.ClockConfig;
import com.yerin.storyq.config.StoryqProperties;
import com.yerin.storyq.controller.AdminJobController;
import com.yerin.storyq.controller.AdminMetricsController;
import com.yerin.storyq.domain.Job;
import com.yerin.storyq.domain.JobStatus;
import com.yerin.storyq.domain.QueueCounts;
import com.yerin.storyq.global.exception.AppException;
import com.yerin.storyq.global.exception.code.JobErrorCode;
import com.yerin.storyq.service.AdminJobService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = {AdminJobController.class, AdminMetricsController.class})
@Import({StoryqProperties.class, ClockConfig.class})
@TestPropertySource(properties = "storyq.admin.token=test-admin-token")
@DisplayName("관리자 API 보안(헤더) - 컨트롤러 경로 보호")
class AdminControllerSecurityTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    AdminJobService adminJobService;

    @Test
    @DisplayName("헤더 없음 → 401로 차단")
    void block_when_header_missing() throws Exception {
        mvc.perform(get("/admin/metrics/queue")).andExpect(status().isUnauthorized());
        mvc.perform(post("/admin/jobs/{id}/replay", "j1")).andExpect(status().isUnauthorized());
        verifyNoInteractions(adminJobService);
    }

    @Test
    @DisplayName("잘못된 토큰 → 401로 차단")
    void blocks_when_header_invalid() throws Exception {
        mvc.perform(get("/admin/metrics/queue").header("X-Admin-Token", "wrong-token"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("정상 토큰 → 큐 깊이 JSON")
    void passes_when_header_valid() throws Exception {
        when(adminJobService.counts()).thenReturn(new QueueCounts(3, 1, 2, 10, 4));

        mvc.perform(get("/admin/metrics/queue").header("X-Admin-Token", "test-admin-token"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.queue").value("story-generation"))
                .andExpect(jsonPath("$.data.waiting").value(3))
                .andExpect(jsonPath("$.data.delayed").value(1))
                .andExpect(jsonPath("$.data.active").value(2))
                .andExpect(jsonPath("$.data.completed").value(10))
                .andExpect(jsonPath("$.data.failed").value(4));
    }

    @Test
    @DisplayName("replay 성공 시 재큐잉된 잡, FAILED 아니면 400")
    void replay() throws Exception {
        when(adminJobService.replay("j1")).thenReturn(
                Job.builder().id("j1").status(JobStatus.QUEUED).attempts(0).maxAttempts(3).priority(0).build());
        when(adminJobService.replay("j2")).thenThrow(new AppException(JobErrorCode.JOB_NOT_FAILED));

        mvc.perform(post("/admin/jobs/{id}/replay", "j1").header("X-Admin-Token", "test-admin-token"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value("j1"))
                .andExpect(jsonPath("$.data.status").value("queued"));

        mvc.perform(post("/admin/jobs/{id}/replay", "j2").header("X-Admin-Token", "test-admin-token"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("JOB-002"));
    }
}
