package com.example.datasheet.controller;

import com.example.datasheet.exception.DocumentNotFoundException;
import com.example.datasheet.exception.UnsupportedFormatException;
import com.example.datasheet.service.DatasheetIdentifyService;
import com.example.datasheet.service.DatasheetSnapshotService;
import com.example.datasheet.service.PinTableService;
import com.example.datasheet.util.identify.dto.IdentifyResult;
import com.example.datasheet.util.rule.dto.DatasheetSnapshot;
import com.example.datasheet.util.table.CanonicalHeaders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DatasheetControllerTest {

    @Mock
    private DatasheetIdentifyService identifyService;

    @Mock
    private PinTableService pinTableService;

    @Mock
    private DatasheetSnapshotService snapshotService;

    @InjectMocks
    private DatasheetController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void identify_shouldReturnResult() throws Exception {
        when(identifyService.identify(Paths.get("/docs/a.html"))).thenReturn(new IdentifyResult(
                "/docs/a.html", "STM32F103C8", Arrays.asList("STM32F103C8", "STM32F103"), Arrays.asList("LQFP48")));

        mockMvc.perform(get("/api/datasheet/identify").param("path", "/docs/a.html"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.result.primary_identifier").value("STM32F103C8"))
                .andExpect(jsonPath("$.result.candidates[1]").value("STM32F103"))
                .andExpect(jsonPath("$.result.packages[0]").value("LQFP48"))
                .andExpect(jsonPath("$.result.family_prefix").value("STM"));
    }

    @Test
    void identify_shouldMapMissingFileTo404() throws Exception {
        Path path = Paths.get("/docs/missing.html");
        when(identifyService.identify(path)).thenThrow(new DocumentNotFoundException(path));

        mockMvc.perform(get("/api/datasheet/identify").param("path", "/docs/missing.html"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void identify_shouldMapUnsupportedFormatTo400() throws Exception {
        Path path = Paths.get("/docs/a.docx");
        when(identifyService.identify(path)).thenThrow(new UnsupportedFormatException(path));

        mockMvc.perform(get("/api/datasheet/identify").param("path", "/docs/a.docx"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void pinTable_shouldReturnSentinelTable() throws Exception {
        Map<String, java.util.List<java.util.List<String>>> tables = new LinkedHashMap<>();
        tables.put(CanonicalHeaders.DEFAULT_PACKAGE, CanonicalHeaders.sentinelTable());
        when(pinTableService.extractPinTable(Paths.get("/docs/a.pdf"))).thenReturn(tables);

        mockMvc.perform(get("/api/datasheet/pin-table").param("path", "/docs/a.pdf"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.DEFAULT_PACKAGE[0][0]").value("Pin Number"))
                .andExpect(jsonPath("$.result.DEFAULT_PACKAGE[0][5]").value("Description"));
    }

    @Test
    void pinTable_shouldMapUnexpectedErrorTo500() throws Exception {
        when(pinTableService.extractPinTable(any(Path.class))).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/api/datasheet/pin-table").param("path", "/docs/a.html"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("boom"));
    }

    @Test
    void snapshot_shouldRejectBlankPath() throws Exception {
        mockMvc.perform(post("/api/datasheet/snapshot")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\": \"  \", \"rules\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verifyNoInteractions(snapshotService);
    }

    @Test
    void snapshot_shouldReturnKeyedSnapshot() throws Exception {
        Map<String, DatasheetSnapshot> snapshot = new LinkedHashMap<>();
        snapshot.put("XYZ1234", new DatasheetSnapshot("xyz.html", CanonicalHeaders.sentinelTable(),
                Collections.emptyList(), ""));
        when(snapshotService.buildSnapshot(any(Path.class), anyList())).thenReturn(snapshot);

        mockMvc.perform(post("/api/datasheet/snapshot")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\": \"/docs/xyz.html\", \"rules\": ["
                                + "{\"group\": \"Power\", \"rule\": \"Decouple VDD pins\", \"pins\": [\"VDD\"], \"essential\": true}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.XYZ1234.filename").value("xyz.html"))
                .andExpect(jsonPath("$.result.XYZ1234.footnote").value(""));
    }
}
