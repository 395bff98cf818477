package org.caureq.opsinsights.api;

import org.caureq.opsinsights.domain.model.RemediationOutcome;
import org.caureq.opsinsights.domain.model.RemediationRecord;
import org.caureq.opsinsights.service.memory.RemediationLog;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = RemediationController.class, properties = "app.api-key=secret")
class RemediationControllerTest {
    private static final String BODY = """
            {"resourceId":"qemu/101","problem":"disk full","action":"purged old logs",
             "outcome":"resolved","timeToResolutionSeconds":600}
            """;

    @Autowired
    MockMvc mvc;

    @MockBean
    RemediationLog remediationLog;

    @Test
    void writeWithoutKeyIsRejected() throws Exception {
        mvc.perform(post("/api/remediations").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH_REQUIRED"));

        verifyNoInteractions(remediationLog);
    }

    @Test
    void writeWithKeyIsLogged() throws Exception {
        when(remediationLog.log(any())).thenAnswer(inv -> ((RemediationRecord) inv.getArgument(0))
                .withIdentity("r-1", Instant.parse("2026-03-08T00:00:00Z")));

        mvc.perform(post("/api/remediations").header("X-API-KEY", "secret")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("r-1"))
                .andExpect(jsonPath("$.outcome").value("resolved"));

        var captor = ArgumentCaptor.forClass(RemediationRecord.class);
        verify(remediationLog).log(captor.capture());
        assertThat(captor.getValue().timeToResolution()).isEqualTo(Duration.ofMinutes(10));
        assertThat(captor.getValue().outcome()).isEqualTo(RemediationOutcome.RESOLVED);
    }

    @Test
    void missingActionIsAValidationError() throws Exception {
        mvc.perform(post("/api/remediations").header("X-API-KEY", "secret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resourceId\":\"qemu/101\",\"problem\":\"disk full\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors[0]").value(startsWith("action")));
    }

    @Test
    void readsStayOpen() throws Exception {
        when(remediationLog.getSimilar("disk full", 5)).thenReturn(List.of());

        mvc.perform(get("/api/remediations/similar").param("q", "disk full"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }
}
