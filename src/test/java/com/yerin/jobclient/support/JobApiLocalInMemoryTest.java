package com.yerin.jobclient.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles({"local-inmem", "test"})
@DisplayName("local-inmem 프로필: enqueue → 조회 → 취소 흐름")
class JobApiLocalInMemoryTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    ObjectMapper objectMapper;

    private String enqueue(String body) throws Exception {
        String json = mvc.perform(post("/jobs").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        JsonNode node = objectMapper.readTree(json);
        return node.path("data").path("jobId").asText();
    }

    @Test
    @DisplayName("새 작업은 queued, 결과 조회는 409")
    void new_job_is_queued() throws Exception {
        String jobId = enqueue("{\"function\":\"app.tasks.noop\",\"args\":[1,2]}");
        assertThat(jobId).isNotBlank();

        mvc.perform(get("/jobs/{id}/status", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("queued"));

        mvc.perform(get("/jobs/{id}/result", jobId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Job is not finished yet (status: queued)"));
    }

    @Test
    @DisplayName("관리자 취소 후 canceled, 재취소는 409")
    void cancel_flow() throws Exception {
        String jobId = enqueue("{\"function\":\"app.tasks.noop\"}");

        mvc.perform(post("/admin/jobs/{id}/cancel", jobId).header("X-Admin-Token", "test-admin-token"))
                .andExpect(status().isOk());

        mvc.perform(get("/jobs/{id}", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("canceled"));

        mvc.perform(post("/admin/jobs/{id}/cancel", jobId).header("X-Admin-Token", "test-admin-token"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("JOB-003"));
    }

    @Test
    @DisplayName("없는 작업은 404")
    void unknown_job() throws Exception {
        mvc.perform(get("/jobs/{id}/meta", "no-such-job"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("JOB-001"));
    }
}
