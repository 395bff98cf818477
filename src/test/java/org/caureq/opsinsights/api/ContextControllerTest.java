package org.caureq.opsinsights.api;

import org.caureq.opsinsights.service.context.ContextAssembler;
import org.caureq.opsinsights.service.context.ContextFormatter;
import org.caureq.opsinsights.service.context.HealthScore;
import org.caureq.opsinsights.service.context.ResourceContext;
import org.caureq.opsinsights.service.context.Section;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ContextController.class)
class ContextControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    ContextAssembler assembler;
    @MockBean
    ContextFormatter formatter;

    private static ResourceContext degradedContext() {
        return new ResourceContext("qemu/101", Instant.parse("2026-03-08T00:00:00Z"),
                Section.empty("trends"),
                Section.unavailable("baselines", "timed out"),
                Section.empty("anomalies"),
                Section.empty("predictions"),
                Section.empty("forecasts"),
                Section.empty("changes"),
                Section.empty("remediations"),
                Section.empty("findings"),
                Section.available("notes", List.of("db primary")),
                new HealthScore(100, "A", List.of()));
    }

    @Test
    void jsonByDefault() throws Exception {
        when(assembler.buildForResource("qemu/101")).thenReturn(degradedContext());

        mvc.perform(get("/api/context/resource").param("resource", "qemu/101"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resourceId").value("qemu/101"))
                .andExpect(jsonPath("$.degraded").value(true))
                .andExpect(jsonPath("$.baselines.status").value("unavailable"))
                .andExpect(jsonPath("$.baselines.reason").value("timed out"))
                .andExpect(jsonPath("$.notes.data[0]").value("db primary"))
                .andExpect(jsonPath("$.notes.available").doesNotExist());
    }

    @Test
    void textFormat() throws Exception {
        var ctx = degradedContext();
        when(assembler.buildForResource("qemu/101")).thenReturn(ctx);
        when(formatter.format(ctx)).thenReturn("# Resource qemu/101");

        mvc.perform(get("/api/context/resource").param("resource", "qemu/101").param("format", "text"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string("# Resource qemu/101"));
    }
}
