package at.sv.planets.report;

import at.sv.planets.riseset.RiseSet;
import at.sv.planets.snapshot.SkySnapshot;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes snapshots and rise/set tables to JSON. Instants are written as ISO-8601 strings in UTC.
 */
public final class JsonReportWriter {

    private final ObjectMapper mapper;

    public JsonReportWriter() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String write(SkySnapshot snapshot, List<RiseSet> riseSets) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("snapshot", snapshot);
        if (riseSets != null) {
            report.put("riseSet", riseSets);
        }
        return toJson(report);
    }

    public String write(SkySnapshot snapshot) {
        return write(snapshot, null);
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize report", e);
        }
    }

    ObjectMapper getMapper() {
        return mapper;
    }
}
