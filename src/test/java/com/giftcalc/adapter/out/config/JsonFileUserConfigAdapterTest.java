package com.giftcalc.adapter.out.config;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.FileSystem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static com.giftcalc.support.TestFutures.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JsonFileUserConfigAdapterTest {

    @TempDir
    Path tempDir;

    private Vertx vertx;
    private Path configFile;
    private JsonFileUserConfigAdapter adapter;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        configFile = tempDir.resolve(".config.json");
        adapter = new JsonFileUserConfigAdapter(vertx.fileSystem(), configFile);
    }

    @AfterEach
    void tearDown() {
        await(vertx.close());
    }

    @Test
    void getCacheTtlHours_shouldBeEmptyWithoutFile() {
        assertEquals(Optional.empty(), await(adapter.getCacheTtlHours()));
    }

    @Test
    void getCacheTtlHours_shouldReadField() throws IOException {
        Files.writeString(configFile, "{\"baseValue\": 70, \"cacheTTLHours\": 12}");

        assertEquals(Optional.of(12), await(adapter.getCacheTtlHours()));
    }

    @Test
    void getCacheTtlHours_shouldBeEmptyWhenFieldAbsent() throws IOException {
        Files.writeString(configFile, "{\"baseValue\": 70}");

        assertTrue(await(adapter.getCacheTtlHours()).isEmpty());
    }

    @Test
    void getCacheTtlHours_shouldIgnoreBrokenFile() throws IOException {
        Files.writeString(configFile, "{ broken");

        assertTrue(await(adapter.getCacheTtlHours()).isEmpty());
    }

    @Test
    void getCacheTtlHours_shouldIgnoreUnreadablePath() throws IOException {
        // A directory where the file should be
        Files.createDirectories(configFile);

        assertTrue(await(adapter.getCacheTtlHours()).isEmpty());
    }

    @Test
    void getCacheTtlHours_shouldPickUpChangesBetweenCalls() throws IOException {
        Files.writeString(configFile, "{\"cacheTTLHours\": 12}");
        assertEquals(Optional.of(12), await(adapter.getCacheTtlHours()));

        Files.writeString(configFile, "{\"cacheTTLHours\": 48}");
        assertEquals(Optional.of(48), await(adapter.getCacheTtlHours()));
    }

    @Test
    void getCacheTtlHours_shouldOnlyUseNonBlockingFileCalls() {
        // Given
        FileSystem fileSystem = mock(FileSystem.class);
        when(fileSystem.exists(anyString())).thenReturn(Future.succeededFuture(true));
        when(fileSystem.readFile(anyString()))
                .thenReturn(Future.succeededFuture(Buffer.buffer("{\"cacheTTLHours\": 6}")));
        JsonFileUserConfigAdapter nonBlocking = new JsonFileUserConfigAdapter(fileSystem, configFile);

        // When
        Optional<Object> hours = await(nonBlocking.getCacheTtlHours());

        // Then
        assertEquals(Optional.of(6), hours);
        verify(fileSystem, never()).existsBlocking(anyString());
        verify(fileSystem, never()).readFileBlocking(anyString());
    }
}
