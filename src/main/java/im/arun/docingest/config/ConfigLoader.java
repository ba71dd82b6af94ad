package im.arun.docingest.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads {@link IngestConfig} from {@code ingest.yaml} on the classpath, then from an explicit file,
 * falling back to built-in defaults. Per-run overrides are merged on top with {@link #load(Map)}.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String RESOURCE_NAME = "ingest.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final IngestConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private IngestConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled resource
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), IngestConfig.class);
                }
                logger.warn("Config file {} not found, trying classpath", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, IngestConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", RESOURCE_NAME);
            return new IngestConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new IngestConfig();
        }
    }

    public IngestConfig load() {
        return load(null);
    }

    public IngestConfig load(Map<String, Object> userOptions) {
        IngestConfig config = copyConfig(defaultConfig);

        if (config.getApiKey() == null || config.getApiKey().isEmpty()) {
            config.setApiKey(System.getenv("RECOGNITION_API_KEY"));
        }

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            try {
                switch (key) {
                    case "worker_count":
                    case "workerCount":
                        config.setWorkerCount(parseInt(value));
                        break;
                    case "inter_item_delay_ms":
                    case "interItemDelayMs":
                        config.setInterItemDelayMs(parseLong(value));
                        break;
                    case "max_retries":
                    case "maxRetries":
                        config.setMaxRetries(parseInt(value));
                        break;
                    case "retry_base_delay_ms":
                    case "retryBaseDelayMs":
                        config.setRetryBaseDelayMs(parseLong(value));
                        break;
                    case "text_threshold":
                    case "textThreshold":
                        config.setTextThreshold(parseInt(value));
                        break;
                    case "max_text_pages":
                    case "maxTextPages":
                        config.setMaxTextPages(parseInt(value));
                        break;
                    case "max_image_dimension":
                    case "maxImageDimension":
                        config.setMaxImageDimension(parseInt(value));
                        break;
                    case "image_quality":
                    case "imageQuality":
                        config.setImageQuality(Float.parseFloat(value.toString()));
                        break;
                    case "render_scale":
                    case "renderScale":
                        config.setRenderScale(Float.parseFloat(value.toString()));
                        break;
                    case "max_payload_bytes":
                    case "maxPayloadBytes":
                        config.setMaxPayloadBytes(parseLong(value));
                        break;
                    case "endpoint":
                        config.setEndpoint(value.toString());
                        break;
                    case "api_key":
                    case "apiKey":
                        config.setApiKey(value.toString());
                        break;
                    case "journal_directory":
                    case "journalDirectory":
                        config.setJournalDirectory(value.toString());
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (NumberFormatException e) {
                logger.error("Invalid value for config key {}: {}", key, value);
            }
        });

        return config;
    }

    private int parseInt(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString().trim());
    }

    private long parseLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(value.toString().trim());
    }

    private IngestConfig copyConfig(IngestConfig source) {
        IngestConfig copy = new IngestConfig();
        copy.setWorkerCount(source.getWorkerCount());
        copy.setInterItemDelayMs(source.getInterItemDelayMs());
        copy.setMaxRetries(source.getMaxRetries());
        copy.setRetryBaseDelayMs(source.getRetryBaseDelayMs());
        copy.setTextThreshold(source.getTextThreshold());
        copy.setMaxTextPages(source.getMaxTextPages());
        copy.setMaxImageDimension(source.getMaxImageDimension());
        copy.setImageQuality(source.getImageQuality());
        copy.setRenderScale(source.getRenderScale());
        copy.setMaxPayloadBytes(source.getMaxPayloadBytes());
        copy.setEndpoint(source.getEndpoint());
        copy.setApiKey(source.getApiKey());
        copy.setConnectTimeoutSeconds(source.getConnectTimeoutSeconds());
        copy.setReadTimeoutSeconds(source.getReadTimeoutSeconds());
        copy.setJournalDirectory(source.getJournalDirectory());
        return copy;
    }
}
