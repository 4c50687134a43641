package com.billing.benchmark.controller;

import com.billing.benchmark.model.GroupLookupResult;
import com.billing.benchmark.service.GroupLookupService;
import com.billing.benchmark.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LookupController.class)
class LookupControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private GroupLookupService lookupService;

    @Test
    void lookup_returnsFoundAndNotFoundResults() throws Exception {
        when(lookupService.lookup(anyList())).thenReturn(List.of(
                GroupLookupResult.builder().key("Aetna|99213|11|—").found(true).proxy(74.16).method("mode").n(12).build(),
                GroupLookupResult.builder().key("Aetna|99999|11|—").found(false).message("No matching group").build()));

        mockMvc.perform(post("/api/v1/lookup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(List.of(
                                TestDataFactory.createDescriptor("Aetna", "99213", "11", ""),
                                TestDataFactory.createDescriptor("Aetna", "99999", "11", "")))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].found").value(true))
                .andExpect(jsonPath("$[0].proxy").value(74.16))
                .andExpect(jsonPath("$[1].found").value(false))
                .andExpect(jsonPath("$[1].proxy").doesNotExist())
                .andExpect(jsonPath("$[1].message").value("No matching group"));
    }

    @Test
    void lookup_emptyBody_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/lookup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[]"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(lookupService);
    }
}
