package com.barometer.core.output;

import com.barometer.core.model.StatusRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes each record as one JSON object per line, e.g.
 * {@code {"text":"ICON  / 12.00 GiB / 50.00 GiB","class":"success","tooltip":"..."}},
 * and flushes immediately so the host sees the update without buffering delay.
 * <p>
 * The line is serialized completely before anything is written, so a failed
 * serialization never leaves a partial line on the stream.
 */
public class JsonLineEmitter implements Emitter {

    private static final Logger log = LoggerFactory.getLogger(JsonLineEmitter.class);

    private final ObjectMapper objectMapper;
    private final PrintStream out;

    public JsonLineEmitter(ObjectMapper objectMapper, PrintStream out) {
        this.objectMapper = objectMapper;
        this.out = out;
    }

    /** Emitter bound to the process's standard output, encoded as UTF-8. */
    public static JsonLineEmitter stdout(ObjectMapper objectMapper) {
        var stream = new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
        return new JsonLineEmitter(objectMapper, stream);
    }

    @Override
    public void emit(StatusRecord record) {
        String line;
        try {
            line = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize status record {}: {}", record, e.getMessage(), e);
            return;
        }
        synchronized (out) {
            out.println(line);
            out.flush();
        }
        log.debug("Emitted {}", line);
    }
}
