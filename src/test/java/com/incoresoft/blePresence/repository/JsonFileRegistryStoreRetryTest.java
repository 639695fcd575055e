package com.incoresoft.blePresence.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.incoresoft.blePresence.domain.registry.dto.BeaconDto;
import com.incoresoft.blePresence.domain.registry.dto.RegistryDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class JsonFileRegistryStoreRetryTest {

    @TempDir
    Path dir;

    @Configuration
    @EnableRetry
    static class RetryConfig {
    }

    private static AnnotationConfigApplicationContext context(ObjectMapper mapper, Path dataFile) {
        AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext();
        ctx.register(RetryConfig.class);
        ctx.registerBean(JsonFileRegistryStore.class, () -> new JsonFileRegistryStore(mapper, dataFile));
        ctx.refresh();
        return ctx;
    }

    @Test
    void unwritableFileFailsAfterRetries() throws Exception {
        Path notADir = dir.resolve("plain-file");
        Files.writeString(notADir, "x", StandardCharsets.UTF_8);

        try (AnnotationConfigApplicationContext ctx = context(new ObjectMapper(), notADir.resolve("ble_data.json"))) {
            RegistryStore store = ctx.getBean(RegistryStore.class);

            long started = System.nanoTime();
            assertThatThrownBy(() -> store.save(RegistryDocument.empty()))
                    .isInstanceOf(RegistryPersistenceException.class);
            long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

            // two 200 ms backoffs between three attempts
            assertThat(elapsedMillis).isGreaterThanOrEqualTo(400L);
        }
    }

    @Test
    void flakyWriteSucceedsOnThirdAttempt() throws Exception {
        Path dataFile = dir.resolve("ble_data.json");
        Files.writeString(dataFile, "{\"devices\":{},\"beacons\":{}}", StandardCharsets.UTF_8);
        ObjectMapper mapper = spy(new ObjectMapper());
        ObjectWriter failing = mock(ObjectWriter.class);
        doThrow(new IOException("device busy")).when(failing).writeValue(any(File.class), any());
        doReturn(failing, failing).doCallRealMethod().when(mapper).writerWithDefaultPrettyPrinter();

        try (AnnotationConfigApplicationContext ctx = context(mapper, dataFile)) {
            RegistryStore store = ctx.getBean(RegistryStore.class);
            RegistryDocument doc = RegistryDocument.empty();
            doc.getBeacons().put("AA:01", new BeaconDto("ESP-C3-1", 1L));

            store.save(doc);

            verify(mapper, times(3)).writerWithDefaultPrettyPrinter();
            assertThat(store.load().getBeacons()).containsKey("AA:01");
        }
    }
}
