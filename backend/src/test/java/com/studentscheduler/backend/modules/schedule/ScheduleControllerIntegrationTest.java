package com.studentscheduler.backend.modules.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studentscheduler.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class ScheduleControllerIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void scheduleLifecycleOverHttp() throws Exception {
        MvcResult created = mockMvc.perform(post("/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "userEmail", "kim@uni.example",
                                "userName", "Kim",
                                "scheduleName", "Spring term",
                                "courses", List.of(course("IT101", 3), course("IT205", 4))
                        ))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.totalCredits").value(7))
                .andExpect(jsonPath("$.courseCount").value(2))
                .andReturn();
        UUID scheduleId = readId(created);

        mockMvc.perform(get("/schedules/user/{identifier}", "KIM@uni.example"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].scheduleId").value(scheduleId.toString()))
                .andExpect(jsonPath("$[0].courseCount").value(2));

        mockMvc.perform(get("/schedules/{id}", scheduleId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.schedule.name").value("Spring term"))
                .andExpect(jsonPath("$.schedule.userEmail").value("kim@uni.example"))
                .andExpect(jsonPath("$.schedule.userName").value("Kim"))
                .andExpect(jsonPath("$.courses.length()").value(2));

        mockMvc.perform(put("/schedules/{id}", scheduleId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "courses", List.of(course("IT300", 2))
                        ))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Spring term"))
                .andExpect(jsonPath("$.totalCredits").value(2));

        mockMvc.perform(delete("/schedules/{id}", scheduleId))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/schedules/{id}", scheduleId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SCHEDULE_NOT_FOUND"));
        mockMvc.perform(delete("/schedules/{id}", scheduleId))
                .andExpect(status().isNotFound());
    }

    @Test
    void emptyCourseListIsRejected() throws Exception {
        mockMvc.perform(post("/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "userEmail", "kim@uni.example",
                                "courses", List.of()
                        ))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("COURSES_REQUIRED"));

        assertThat(countRows("select count(*) from app_user")).isZero();
    }

    @Test
    void missingOwnerEmailIsRejected() throws Exception {
        mockMvc.perform(post("/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "userId", UUID.randomUUID().toString(),
                                "courses", List.of(course("IT101", 3))
                        ))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("EMAIL_REQUIRED"));
    }

    @Test
    void courseWithoutCreditsFailsBeanValidation() throws Exception {
        mockMvc.perform(post("/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"userEmail":"kim@uni.example","courses":[{"courseCode":"IT101","name":"Intro"}]}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void malformedScheduleIdIsABadRequest() throws Exception {
        mockMvc.perform(get("/schedules/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_parameter"));
    }

    @Test
    void requestIdIsEchoedOrGenerated() throws Exception {
        mockMvc.perform(get("/schedules/user/{identifier}", "nobody@uni.example")
                        .header("X-Request-Id", "trace-123"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "trace-123"))
                .andExpect(jsonPath("$.length()").value(0));

        MvcResult result = mockMvc.perform(get("/schedules/user/{identifier}", "nobody@uni.example"))
                .andExpect(status().isOk())
                .andReturn();
        assertThat(result.getResponse().getHeader("X-Request-Id")).isNotBlank();
    }

    private static Map<String, Object> course(String code, int credits) {
        return Map.of(
                "courseCode", code,
                "name", code + " lecture",
                "credits", credits,
                "instructor", "Dr. Lee",
                "time", "Tue 13:00-15:00",
                "room", "A-101"
        );
    }

    private UUID readId(MvcResult result) throws Exception {
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return UUID.fromString(body.get("scheduleId").asText());
    }
}
