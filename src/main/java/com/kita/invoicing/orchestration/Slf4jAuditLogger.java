package com.kita.invoicing.orchestration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes audit entries as JSON lines to the {@code kita.audit} logger
 */
public class Slf4jAuditLogger implements AuditLogger {

    private static final Logger logger = LoggerFactory.getLogger(Slf4jAuditLogger.class);
    private static final Logger audit = LoggerFactory.getLogger("kita.audit");

    private final ObjectMapper objectMapper;

    public Slf4jAuditLogger() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
    }

    @Override
    public void log(String actor, String action, String entityType, String entityId,
                    Map<String, Object> before, Map<String, Object> after) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("actor", actor);
        entry.put("action", action);
        entry.put("entityType", entityType);
        entry.put("entityId", entityId);
        entry.put("before", before);
        entry.put("after", after);
        audit.info(toJson(entry));
    }

    String toJson(Map<String, Object> entry) {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            logger.warn("Audit entry could not be serialized: {}", e.getOriginalMessage());
            return entry.toString();
        }
    }
}
