package com.synergi.dispatch.api;

import com.synergi.core.model.WorkerEntry;
import com.synergi.core.registry.RegistrySort;
import com.synergi.core.registry.WorkerRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RegistryController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class RegistryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WorkerRegistry registry;

    private static WorkerEntry worker(String id, String category, String price, int rep) {
        return new WorkerEntry(id, id, category, "local:" + category, id, new BigDecimal(price), rep,
                3, 1, new BigDecimal("0.003"), true, 0, 4000.0);
    }

    @Test
    void listsWorkersByEfficiencyByDefault() throws Exception {
        when(registry.listAll(null, RegistrySort.EFFICIENCY))
                .thenReturn(List.of(worker("calc", "math", "0.001", 90), worker("wx", "data", "0.002", 80)));

        mockMvc.perform(get("/api/v1/registry"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sort").value("efficiency"))
                .andExpect(jsonPath("$.category").doesNotExist())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.workers[0].id").value("calc"))
                .andExpect(jsonPath("$.workers[0].reputation").value(90))
                .andExpect(jsonPath("$.workers[1].category").value("data"));
    }

    @Test
    void filtersByCategoryAndSort() throws Exception {
        when(registry.listAll("math", RegistrySort.PRICE)).thenReturn(List.of(worker("calc", "math", "0.001", 90)));

        mockMvc.perform(get("/api/v1/registry").param("category", "math").param("sort", "price"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sort").value("price"))
                .andExpect(jsonPath("$.category").value("math"))
                .andExpect(jsonPath("$.workers", hasSize(1)));
    }

    @Test
    void rejectsUnknownSort() throws Exception {
        mockMvc.perform(get("/api/v1/registry").param("sort", "vibes"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid sort: vibes"));

        verify(registry, never()).listAll(any(), any());
    }
}
