package com.notifica.emisor.controller;

import com.notifica.emisor.batch.EmissionRunModels.EmissionRun;
import com.notifica.emisor.batch.EmissionRunModels.RunState;
import com.notifica.emisor.dto.EmissionRequest;
import com.notifica.emisor.dto.EmissionRunSummary;
import com.notifica.emisor.service.EmissionEngine;
import com.notifica.emisor.service.EmissionExportService;
import com.notifica.emisor.service.EmissionValidationException;
import com.notifica.emisor.service.SequenceLookupException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.io.OutputStream;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = EmissionController.class)
@ActiveProfiles("test")
class EmissionControllerTest {

    @Autowired private MockMvc mockMvc;
    @MockBean private EmissionEngine emissionEngine;
    @MockBean private EmissionExportService exportService;

    private final MockMultipartFile file = new MockMultipartFile("file", "lote.csv", "text/csv",
            "account,print_order\nA1,1\n".getBytes());

    @Test
    void emitReturnsSummary() throws Exception {
        EmissionRunSummary summary = new EmissionRunSummary();
        summary.setSessionId("s-1");
        summary.setState("DONE");
        summary.setPdfsGenerated(1);
        when(emissionEngine.emit(any(), any())).thenReturn(summary);

        mockMvc.perform(multipart("/api/emissions").file(file)
                        .param("projectId", "1")
                        .param("templateId", "2")
                        .param("documentType", "NOT")
                        .param("emissionDate", "2024-01-05"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("s-1"))
                .andExpect(jsonPath("$.pdfsGenerated").value(1));

        ArgumentCaptor<EmissionRequest> captor = ArgumentCaptor.forClass(EmissionRequest.class);
        verify(emissionEngine).emit(captor.capture(), any());
        assertThat(captor.getValue().emissionDate()).isEqualTo(LocalDate.of(2024, 1, 5));
        assertThat(captor.getValue().sourceFilename()).isEqualTo("lote.csv");
        assertThat(captor.getValue().pmoLabel()).isNull();
    }

    @Test
    void validationFailureIsBadRequestWithProblems() throws Exception {
        when(emissionEngine.emit(any(), any())).thenThrow(new EmissionValidationException(
                "CSV has 1 invalid record(s)", List.of("line 3: print_order 1 already used on line 2")));

        mockMvc.perform(multipart("/api/emissions").file(file)
                        .param("projectId", "1")
                        .param("templateId", "2")
                        .param("documentType", "NOT")
                        .param("emissionDate", "2024-01-05"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.problems[0]").value("line 3: print_order 1 already used on line 2"));
    }

    @Test
    void sequenceLookupFailureIsServiceUnavailable() throws Exception {
        when(emissionEngine.emit(any(), any())).thenThrow(new SequenceLookupException("PMO history unavailable", null));

        mockMvc.perform(multipart("/api/emissions").file(file)
                        .param("projectId", "1")
                        .param("templateId", "2")
                        .param("documentType", "NOT")
                        .param("emissionDate", "2024-01-05"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("PMO history unavailable"));
    }

    @Test
    void asyncStartIsAccepted() throws Exception {
        EmissionRun run = new EmissionRun("s-2");
        when(emissionEngine.startAsync(any(), any())).thenReturn(run);

        mockMvc.perform(multipart("/api/emissions/async").file(file)
                        .param("projectId", "1")
                        .param("templateId", "2")
                        .param("documentType", "NOT")
                        .param("emissionDate", "2024-01-05"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.sessionId").value("s-2"))
                .andExpect(jsonPath("$.state").value("CREATED"));
    }

    @Test
    void statusOfUnknownRunIsNotFound() throws Exception {
        mockMvc.perform(get("/api/emissions/nope/status"))
                .andExpect(status().isNotFound());
    }

    @Test
    void statusReportsProgress() throws Exception {
        EmissionRun run = new EmissionRun("s-3");
        run.transition(RunState.CSV_LOADED);
        run.total.set(5);
        when(emissionEngine.status("s-3")).thenReturn(run);

        mockMvc.perform(get("/api/emissions/s-3/status").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("CSV_LOADED"))
                .andExpect(jsonPath("$.total").value(5))
                .andExpect(jsonPath("$.cancelRequested").value(false));
    }

    @Test
    void cancelOfFinishedRunIsConflict() throws Exception {
        when(emissionEngine.cancel("s-4")).thenReturn(false);
        mockMvc.perform(post("/api/emissions/s-4/cancel"))
                .andExpect(status().isConflict());

        when(emissionEngine.cancel("s-5")).thenReturn(true);
        mockMvc.perform(post("/api/emissions/s-5/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    void previewStreamsPdf() throws Exception {
        byte[] pdf = "%PDF-1.7 test".getBytes();
        when(emissionEngine.renderPreview(1L, 2L, "A1")).thenReturn(pdf);

        mockMvc.perform(post("/api/emissions/preview")
                        .param("projectId", "1")
                        .param("templateId", "2")
                        .param("account", "A1"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_PDF))
                .andExpect(content().bytes(pdf));
    }

    @Test
    void zipOfUnknownSessionIsNotFound() throws Exception {
        doThrow(new IllegalArgumentException("No artifacts for session s-6"))
                .when(exportService).writeZip(eq("s-6"), any(OutputStream.class));

        mockMvc.perform(get("/api/emissions/s-6/zip"))
                .andExpect(status().isNotFound());
    }
}
