package com.dragnet.datasource.file;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.dragnet.core.exception.SourceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonRecordReaderTest {

    @TempDir
    Path dir;

    @Test
    void readsFilesInOrderSkippingBadLines() throws Exception {
        Path first = Files.writeString(
                dir.resolve("1.log"),
                """
                {"n": 1, "req": {"method": "GET"}}

                not json
                {"n": 2}
                [1, 2]
                """);
        Path second = Files.writeString(dir.resolve("2.log"), "null\n{\"n\": 3}");

        List<Map<String, Object>> records = new ArrayList<>();
        try (JsonRecordReader reader = new JsonRecordReader(List.of(first, second))) {
            reader.forEachRemaining(records::add);

            assertThat(reader.records()).isEqualTo(3);
            assertThat(reader.invalidLines()).isEqualTo(3);
            assertThat(reader.hasNext()).isFalse();
            assertThrows(NoSuchElementException.class, reader::next);
        }

        assertThat(records).extracting(r -> r.get("n")).containsExactly(1, 2, 3);
        assertThat(records.get(0).get("req")).isEqualTo(Map.of("method", "GET"));
    }

    @Test
    void closeStopsReading() throws Exception {
        Path file = Files.writeString(dir.resolve("1.log"), "{\"n\": 1}\n{\"n\": 2}\n");
        JsonRecordReader reader = new JsonRecordReader(List.of(file));

        assertThat(reader.next()).containsEntry("n", 1);
        reader.close();
        reader.close();

        assertThat(reader.hasNext()).isFalse();
    }

    @Test
    void unreadableFileIsASourceError() {
        JsonRecordReader reader = new JsonRecordReader(List.of(dir.resolve("gone.log")));

        assertThrows(SourceException.class, reader::hasNext);
    }

    @Test
    void noFilesNoRecords() {
        try (JsonRecordReader reader = new JsonRecordReader(List.of())) {
            assertThat(reader.hasNext()).isFalse();
        }
    }
}
