package org.example.campusschedule.controller;

import org.example.campusschedule.config.SecurityConfig;
import org.example.campusschedule.exception.ReadFailureException;
import org.example.campusschedule.repository.DocumentStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = HealthController.class)
@Import(SecurityConfig.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private DocumentStore store;

    @Test
    void rootAnswersWithServiceName() throws Exception {
        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Student Schedule Organizer API"));
    }

    @Test
    void reportsDisabledStore() throws Exception {
        when(store.isAvailable()).thenReturn(false);

        mvc.perform(get("/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.database").value("Not Available"))
                .andExpect(jsonPath("$.connection_status").value("Not Connected"));
    }

    @Test
    void listsAtMostTenCollections() throws Exception {
        when(store.isAvailable()).thenReturn(true);
        when(store.listCollectionNames()).thenReturn(IntStream.range(0, 12).mapToObj(i -> "c" + i).collect(Collectors.toList()));

        mvc.perform(get("/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.database").value("Connected & Working"))
                .andExpect(jsonPath("$.collections", hasSize(10)));
    }

    @Test
    void storeErrorStillAnswers200() throws Exception {
        when(store.isAvailable()).thenReturn(true);
        when(store.listCollectionNames()).thenThrow(new ReadFailureException("*", new RuntimeException("not authorized on admin")));

        mvc.perform(get("/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.database", startsWith("Connected but Error: ")))
                .andExpect(jsonPath("$.collections", hasSize(0)));
    }
}
