package fr.lapetina.airouting.dashboard;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Serialises {@link PerformanceExport} dumps as JSON.
 */
public final class SnapshotExporter {

    private static final Logger log = LoggerFactory.getLogger(SnapshotExporter.class);

    private final ObjectMapper objectMapper;

    public SnapshotExporter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(PerformanceExport export, OutputStream out) throws IOException {
        objectMapper.writeValue(out, export);
        log.info("Performance data exported: operations={}, alerts={}",
                export.operations().size(), export.alerts().size());
    }

    public String toJson(PerformanceExport export) throws JsonProcessingException {
        return objectMapper.writeValueAsString(export);
    }
}
