// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.blobsync.tools.common.BlockRoot;
import org.blobsync.tools.common.SyncException;
import org.blobsync.tools.common.SyncException.Kind;
import org.blobsync.tools.sync.SlotWriteRecord;
import org.blobsync.tools.utils.TestSidecars;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for {@link JsonLinesSink}.
 */
class JsonLinesSinkTest {

    @TempDir
    Path tempDir;

    private static SlotWriteRecord record(long slot, int blobs) {
        return new SlotWriteRecord(
                slot, BlockRoot.parse(TestSidecars.rootFor(slot)), TestSidecars.sidecars(slot, blobs));
    }

    @Test
    @DisplayName("Writes one newline terminated line per slot with slot and data")
    void writesOneLinePerSlot() throws IOException {
        final Path file = tempDir.resolve(JsonLinesSink.DEFAULT_FILE_NAME);
        try (JsonLinesSink sink = new JsonLinesSink(file)) {
            sink.commit(List.of(record(10, 2), new SlotWriteRecord(11, BlockRoot.EMPTY, List.of())));
        }

        final String content = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(content.endsWith("\n"), "every line is terminated");
        final List<String> lines = content.lines().toList();
        assertEquals(2, lines.size());

        final JsonObject first = JsonParser.parseString(lines.get(0)).getAsJsonObject();
        assertEquals(10, first.get("slot").getAsLong());
        assertEquals(2, first.getAsJsonArray("data").size());
        final JsonObject sidecar = first.getAsJsonArray("data").get(1).getAsJsonObject();
        assertEquals("1", sidecar.get("index").getAsString());
        assertEquals(TestSidecars.sidecar(10, 1).kzgCommitment(), sidecar.get("kzg_commitment").getAsString());
        assertEquals(
                "10",
                sidecar.getAsJsonObject("signed_block_header")
                        .getAsJsonObject("message")
                        .get("slot")
                        .getAsString());

        final JsonObject second = JsonParser.parseString(lines.get(1)).getAsJsonObject();
        assertEquals(11, second.get("slot").getAsLong());
        assertEquals(0, second.getAsJsonArray("data").size());
    }

    @Test
    @DisplayName("Commits append after existing content")
    void appendsToExistingFile() throws IOException {
        final Path file = tempDir.resolve(JsonLinesSink.DEFAULT_FILE_NAME);
        Files.writeString(file, "{\"slot\":1,\"data\":[]}\n", StandardCharsets.UTF_8);

        final JsonLinesSink sink = new JsonLinesSink(file);
        sink.commit(List.of(record(20, 1)));
        sink.commit(List.of(record(21, 1), record(22, 1)));

        final List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(4, lines.size());
        assertEquals("{\"slot\":1,\"data\":[]}", lines.get(0));
        assertEquals(22, JsonParser.parseString(lines.get(3)).getAsJsonObject().get("slot").getAsLong());
    }

    @Test
    @DisplayName("Unwritable file fails with SINK_COMMIT")
    void unwritableFile() {
        final JsonLinesSink sink = new JsonLinesSink(tempDir.resolve("missing-dir").resolve("blobs.jsonl"));
        final SyncException e = assertThrows(SyncException.class, () -> sink.commit(List.of(record(5, 1))));
        assertEquals(Kind.SINK_COMMIT, e.kind());
        assertEquals(5, e.slot().getAsLong());
    }
}
