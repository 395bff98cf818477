package org.caureq.opsinsights.service.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.caureq.opsinsights.config.InsightsProps;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/** Hands out the state files of the engine components, all under one data directory. */
@Slf4j
@Component
public class StateFiles {
    private final Path dataDir;
    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    @Autowired
    public StateFiles(InsightsProps props) {
        this(Path.of(props.storage().dataDir()));
        log.info("[Storage] state directory {}", dataDir.toAbsolutePath());
    }

    public StateFiles(Path dataDir) {
        this.dataDir = dataDir;
    }

    public JsonStateFile file(String name) {
        return new JsonStateFile(dataDir.resolve(name), om);
    }

    public ObjectMapper mapper() { return om; }
}
