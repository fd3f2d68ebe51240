package com.meddollina.assistant.service.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

@Component
public class NdjsonPerformanceLogSink implements PerformanceLogSink {

    private static final Logger log = LoggerFactory.getLogger(NdjsonPerformanceLogSink.class);

    private final ObjectMapper objectMapper;
    private final Path logPath;
    private final Object lock = new Object();

    public NdjsonPerformanceLogSink(ObjectMapper objectMapper,
                                    @Value("${assistant.metrics.log-path:llm_performance.log}") String logPath) {
        this.objectMapper = objectMapper;
        this.logPath = Path.of(logPath);
    }

    @Override
    public void append(Object record) {
        String line;
        try {
            line = objectMapper.writeValueAsString(record) + '\n';
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Performance record is not serializable: " + record.getClass().getSimpleName(), ex);
        }
        synchronized (lock) {
            try {
                Files.writeString(logPath, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException ex) {
                // the log is diagnostics only; answering continues without it
                log.warn("Unable to append to performance log {}: {}", logPath, ex.getMessage());
            }
        }
    }

    Path logPath() {
        return logPath;
    }
}
