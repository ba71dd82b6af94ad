package im.arun.docingest.config;

import lombok.Data;

@Data
public class IngestConfig {
    private int workerCount = 3;
    private long interItemDelayMs = 0;
    private int maxRetries = 3;
    private long retryBaseDelayMs = 1000;
    private int textThreshold = 10;
    private int maxTextPages = 5;
    private int maxImageDimension = 2000;
    private float imageQuality = 0.85f;
    private float renderScale = 1.5f;
    private long maxPayloadBytes = 8L * 1024 * 1024;
    private String endpoint = "http://localhost:54321/functions/v1/ocr-scan";
    private String apiKey;
    private int connectTimeoutSeconds = 30;
    private int readTimeoutSeconds = 120;
    private String journalDirectory = "./logs";
}
