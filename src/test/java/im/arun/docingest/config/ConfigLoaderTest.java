package im.arun.docingest.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigLoaderTest {

    /**
     * Without an explicit file the bundled ingest.yaml on the classpath is used.
     */
    @Test
    void loadsClasspathResource() {
        IngestConfig config = new ConfigLoader().load();

        assertThat(config.getWorkerCount()).isEqualTo(2);
        assertThat(config.getMaxRetries()).isEqualTo(4);
        assertThat(config.getRetryBaseDelayMs()).isZero();
        assertThat(config.getMaxImageDimension()).isEqualTo(800);
        assertThat(config.getJournalDirectory()).isNull();
        // untouched keys keep their defaults
        assertThat(config.getReadTimeoutSeconds()).isEqualTo(120);
    }

    /**
     * An explicit config file takes precedence over the classpath resource.
     */
    @Test
    void explicitFileWins(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("custom.yaml");
        Files.writeString(file, "workerCount: 7\ntextThreshold: 25\n");

        IngestConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getWorkerCount()).isEqualTo(7);
        assertThat(config.getTextThreshold()).isEqualTo(25);
        assertThat(config.getMaxRetries()).isEqualTo(3);
    }

    /**
     * A missing file falls back to the classpath resource instead of failing.
     */
    @Test
    void missingFileFallsBack(@TempDir Path dir) {
        IngestConfig config = new ConfigLoader(dir.resolve("absent.yaml").toString()).load();

        assertThat(config.getWorkerCount()).isEqualTo(2);
    }

    /**
     * Overrides accept both key spellings; null values and bad numbers leave the loaded value alone.
     */
    @Test
    void overridesApply() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("worker_count", 5);
        overrides.put("maxRetries", "6");
        overrides.put("image_quality", "0.5");
        overrides.put("textThreshold", null);
        overrides.put("maxTextPages", "many");
        overrides.put("endpoint", "http://ocr.internal/scan");

        IngestConfig config = new ConfigLoader().load(overrides);

        assertThat(config.getWorkerCount()).isEqualTo(5);
        assertThat(config.getMaxRetries()).isEqualTo(6);
        assertThat(config.getImageQuality()).isEqualTo(0.5f);
        assertThat(config.getTextThreshold()).isEqualTo(10);
        assertThat(config.getMaxTextPages()).isEqualTo(5);
        assertThat(config.getEndpoint()).isEqualTo("http://ocr.internal/scan");
    }

    /**
     * Each load returns an independent copy.
     */
    @Test
    void loadsAreIndependent() {
        ConfigLoader loader = new ConfigLoader();
        IngestConfig first = loader.load();
        first.setWorkerCount(99);

        assertThat(loader.load().getWorkerCount()).isEqualTo(2);
    }
}
