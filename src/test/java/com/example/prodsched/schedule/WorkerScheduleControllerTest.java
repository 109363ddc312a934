package com.example.prodsched.schedule;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.contains;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class WorkerScheduleControllerTest {

    private static final String BASE = "/api/scenarios/baseline";

    @Autowired
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() throws Exception {
        mockMvc.perform(delete(BASE + "/assignments")).andExpect(status().isOk());
        mockMvc.perform(post(BASE + "/assignments/auto")).andExpect(status().isOk());
    }

    @Test
    void baselineScenario_isLoadedAtStartup() throws Exception {
        mockMvc.perform(get("/api/scenarios"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[?(@.id == 'baseline')].taskCount").value(6));
        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("UP"));
    }

    @Test
    void workerSchedule_listsAssignedTasksInStartOrder() throws Exception {
        mockMvc.perform(get(BASE + "/workers/{workerId}", "Mechanic Team 2 (Avionics)_1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.schedule.displayName").value("Mechanic #1 - Mechanic Team 2 (Avionics)"))
            .andExpect(jsonPath("$.data.schedule.tasks[*].taskId", contains("2001")))
            .andExpect(jsonPath("$.data.totalTasks").value(1));

        mockMvc.perform(get(BASE + "/workers/{workerId}", "Mechanic Team 1_2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.schedule.tasks[*].taskId", contains("1002")));
    }

    @Test
    void workerSchedule_dateFilterAndUnknownWorker() throws Exception {
        mockMvc.perform(get(BASE + "/workers/{workerId}", "Quality Team 1_1").param("date", "2025-08-26"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.totalTasks").value(0));

        mockMvc.perform(get(BASE + "/workers/{workerId}", "Mechanic Team 9_1"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void aggregatedSchedule_filtersByRole() throws Exception {
        mockMvc.perform(get(BASE + "/workers"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.totalWorkers").value(7));

        mockMvc.perform(get(BASE + "/workers").param("role", "all-customer"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.totalWorkers").value(1))
            .andExpect(jsonPath("$.data.tasks[0].taskId").value("CC_1001"))
            .andExpect(jsonPath("$.data.tasks[0].assignedTo").value("Customer Team 1_1"));

        mockMvc.perform(get(BASE + "/workers").param("role", "supervisors"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void teamSchedule_filtersBySkill() throws Exception {
        mockMvc.perform(get(BASE + "/teams/{team}/schedule", "Mechanic Team 2").param("skill", "Hydraulics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.teamName").value("Mechanic Team 2"))
            .andExpect(jsonPath("$.data.totalWorkers").value(1))
            .andExpect(jsonPath("$.data.tasks[*].taskId", contains("LP_3001")));
    }
}
