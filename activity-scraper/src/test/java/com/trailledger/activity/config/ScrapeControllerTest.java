package com.trailledger.activity.config;

import com.trailledger.activity.model.Person;
import com.trailledger.activity.output.HistoryCsvWriter;
import com.trailledger.activity.service.HistoryQueryService;
import com.trailledger.activity.service.ScrapeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ScrapeControllerTest {

    @Mock
    private ScrapeService scrapeService;

    @Mock
    private HistoryQueryService historyQueryService;

    @Mock
    private HistoryCsvWriter historyCsvWriter;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ScrapeController(scrapeService, historyQueryService, historyCsvWriter))
                .build();
    }

    @Test
    void triggerIsRejectedWhileRunning() throws Exception {
        when(scrapeService.isRunning()).thenReturn(true);

        mockMvc.perform(post("/scrape/trigger"))
                .andExpect(status().isConflict());
    }

    @Test
    void statusReportsRecentRuns() throws Exception {
        when(scrapeService.isAdapterAvailable()).thenReturn(false);
        when(scrapeService.recentRuns()).thenReturn(List.of());

        mockMvc.perform(get("/scrape/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.adapterAvailable").value(false))
                .andExpect(jsonPath("$.recentRuns").isArray());
    }

    @Test
    void unknownPersonIsBadRequest() throws Exception {
        when(historyQueryService.whatDid(null, "nobody", null))
                .thenThrow(new IllegalArgumentException("No person with user name nobody"));

        mockMvc.perform(get("/history/whatdid").param("user", "nobody"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No person with user name nobody"));
    }

    @Test
    void whoWithParsesIsoDate() throws Exception {
        Person jane = Person.builder().profileUrl("https://club.example/members/jdoe").fullName("Jane Doe").build();
        when(historyQueryService.whoWith(null, "jdoe", LocalDate.of(2024, 7, 13)))
                .thenReturn(new HistoryQueryService.WhoWith(jane, List.of(), List.of()));

        mockMvc.perform(get("/history/whowith").param("user", "jdoe").param("date", "2024-07-13"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.person.fullName").value("Jane Doe"));
    }

    @Test
    void exportWritesCsv() throws Exception {
        Person jane = Person.builder().profileUrl("https://club.example/members/jdoe").fullName("Jane Doe").build();
        when(historyQueryService.selectPerson(null, "jdoe")).thenReturn(jane);
        when(historyQueryService.whatDid(jane.getProfileUrl(), null, null)).thenReturn(List.of());
        when(historyCsvWriter.write(eq(jane), any())).thenReturn(Path.of("/data/output/history_jane-doe.csv"));

        mockMvc.perform(post("/history/export").param("user", "jdoe"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activities").value(0));

        verify(historyCsvWriter).write(eq(jane), any());
    }
}
