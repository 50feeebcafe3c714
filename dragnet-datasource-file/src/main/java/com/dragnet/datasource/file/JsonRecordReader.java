package com.dragnet.datasource.file;

import com.dragnet.core.exception.SourceException;
import com.dragnet.core.json.JsonUtil;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads newline-separated JSON objects from a list of files, one file after another. Lines that are not JSON objects
 * are counted and skipped. Files are opened lazily and closed as soon as they are exhausted.
 */
@Slf4j
public final class JsonRecordReader implements Iterator<Map<String, Object>>, AutoCloseable {

    private static final int LOGGED_INVALID_LINES = 10;

    private final List<Path> files;
    private final AtomicLong invalidLines = new AtomicLong();
    private final AtomicLong records = new AtomicLong();
    private int nextFile;
    private Path current;
    private BufferedReader reader;
    private long lineNumber;
    private Map<String, Object> next;
    private boolean closed;

    public JsonRecordReader(List<Path> files) {
        this.files = List.copyOf(files);
    }

    @Override
    public boolean hasNext() {
        if (next == null && !closed) {
            next = readNext();
        }
        return next != null;
    }

    @Override
    public Map<String, Object> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Map<String, Object> record = next;
        next = null;
        records.incrementAndGet();
        return record;
    }

    private Map<String, Object> readNext() {
        try {
            while (true) {
                if (reader == null) {
                    if (nextFile >= files.size()) {
                        return null;
                    }
                    current = files.get(nextFile++);
                    reader = Files.newBufferedReader(current, StandardCharsets.UTF_8);
                    lineNumber = 0;
                }
                String line = reader.readLine();
                if (line == null) {
                    closeCurrent();
                    continue;
                }
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                Map<String, Object> record = parse(line);
                if (record != null) {
                    return record;
                }
            }
        } catch (IOException e) {
            throw new SourceException("reading \"" + current + "\": " + e.getMessage(), e);
        }
    }

    private Map<String, Object> parse(String line) {
        Map<String, Object> record = null;
        String problem = "not an object";
        try {
            record = JsonUtil.parseObject(line);
        } catch (IllegalArgumentException e) {
            problem = e.getMessage();
        }
        if (record == null) {
            long n = invalidLines.incrementAndGet();
            if (n <= LOGGED_INVALID_LINES) {
                log.warn("Skipping invalid record file={} line={} problem={}", current, lineNumber, problem);
            } else {
                log.debug("Skipping invalid record file={} line={} problem={}", current, lineNumber, problem);
            }
        }
        return record;
    }

    private void closeCurrent() throws IOException {
        if (reader != null) {
            BufferedReader r = reader;
            reader = null;
            r.close();
        }
    }

    /** Lines skipped because they did not hold a JSON object. */
    public long invalidLines() {
        return invalidLines.get();
    }

    public long records() {
        return records.get();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        next = null;
        try {
            closeCurrent();
        } catch (IOException e) {
            log.warn("Failed to close {}", current, e);
        }
    }
}
