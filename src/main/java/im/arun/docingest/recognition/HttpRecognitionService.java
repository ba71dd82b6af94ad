package im.arun.docingest.recognition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.docingest.config.IngestConfig;
import im.arun.docingest.model.RecognitionRequest;
import im.arun.docingest.model.RecognitionResult;
import okhttp3.ConnectionPool;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * JSON-over-HTTP client for the OCR scan endpoint.
 * Makes exactly one call per {@link #recognize}; retrying is {@link RecognitionClient}'s job.
 */
public class HttpRecognitionService implements RecognitionService {
    private static final Logger logger = LoggerFactory.getLogger(HttpRecognitionService.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final String endpoint;
    private final String apiKey;
    private final ObjectMapper objectMapper;

    public HttpRecognitionService(IngestConfig config) {
        this(config.getEndpoint(), config.getApiKey(), new OkHttpClient.Builder()
                .connectTimeout(config.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(config.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .connectionPool(new ConnectionPool(Math.max(config.getWorkerCount(), 1), 5, TimeUnit.MINUTES))
                .build());
    }

    public HttpRecognitionService(String endpoint, String apiKey, OkHttpClient httpClient) {
        if (endpoint == null || endpoint.isEmpty()) {
            throw new IllegalArgumentException("Recognition endpoint must be configured");
        }
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public RecognitionResult recognize(RecognitionRequest recognitionRequest) throws RecognitionServiceException {
        String jsonBody;
        try {
            jsonBody = objectMapper.writeValueAsString(buildBody(recognitionRequest));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize recognition request", e);
        }

        Request.Builder builder = new Request.Builder()
                .url(endpoint)
                .addHeader("Content-Type", "application/json")
                .post(RequestBody.create(jsonBody, JSON));
        if (apiKey != null && !apiKey.isEmpty()) {
            builder.addHeader("Authorization", "Bearer " + apiKey);
        }
        if (recognitionRequest.getTenantId() != null) {
            builder.addHeader("X-Tenant-Id", recognitionRequest.getTenantId());
        }

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            ResponseBody body = response.body();
            String responseText = body != null ? body.string() : "";

            if (!response.isSuccessful()) {
                throw new RecognitionServiceException(classify(response.code()),
                        "Recognition service error (HTTP " + response.code() + "): " + errorMessage(responseText),
                        response.code(), null);
            }
            return parseResult(responseText, response.code());
        } catch (IOException e) {
            throw new RecognitionServiceException(FailureCause.UNREACHABLE,
                    "Recognition service unreachable: " + e.getMessage(), -1, e);
        }
    }

    Map<String, Object> buildBody(RecognitionRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (request.isTextMode()) {
            body.put("textData", request.getText());
            body.put("isPdf", true);
        } else {
            body.put("imageData", request.getImage().toDataUrl());
            body.put("isPdf", false);
        }
        body.put("extractionFields", request.getExtractionFields());
        body.put("tableExtractionFields", request.getTableFields());
        body.put("enableCheckScanning", request.isCheckedFieldsEnabled());
        if (request.getTenantId() != null) {
            body.put("customerId", request.getTenantId());
        }
        return body;
    }

    private RecognitionResult parseResult(String responseText, int statusCode) throws RecognitionServiceException {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseText);
        } catch (JsonProcessingException e) {
            throw new RecognitionServiceException(FailureCause.MALFORMED_RESPONSE,
                    "Unparseable recognition response: " + e.getOriginalMessage(), statusCode, e);
        }
        if (root == null || !root.isObject()) {
            throw new RecognitionServiceException(FailureCause.MALFORMED_RESPONSE,
                    "Recognition response is not a JSON object", statusCode, null);
        }
        if (root.hasNonNull("error")) {
            throw new RecognitionServiceException(FailureCause.MALFORMED_RESPONSE,
                    "Recognition service returned error: " + root.get("error").asText(), statusCode, null);
        }

        try {
            RecognitionResult result = objectMapper.treeToValue(root, RecognitionResult.class);
            if (result.getMetadata() == null) {
                result.setMetadata(new LinkedHashMap<>());
            }
            if (result.getLineItems() == null) {
                result.setLineItems(new ArrayList<>());
            }
            logger.debug("Recognition returned {} chars, {} fields, {} line items",
                    result.getText() == null ? 0 : result.getText().length(),
                    result.getMetadata().size(), result.getLineItems().size());
            return result;
        } catch (JsonProcessingException e) {
            throw new RecognitionServiceException(FailureCause.MALFORMED_RESPONSE,
                    "Recognition response has unexpected shape: " + e.getOriginalMessage(), statusCode, e);
        }
    }

    private String errorMessage(String responseText) {
        if (responseText == null || responseText.isEmpty()) {
            return "No error body";
        }
        try {
            JsonNode node = objectMapper.readTree(responseText);
            if (node != null && node.hasNonNull("error")) {
                return node.get("error").asText();
            }
        } catch (JsonProcessingException e) {
            logger.debug("Error body is not JSON: {}", e.getOriginalMessage());
        }
        return responseText;
    }

    static FailureCause classify(int statusCode) {
        if (statusCode == 429 || statusCode == 408 || statusCode >= 500) {
            return FailureCause.UNREACHABLE;
        }
        return FailureCause.MALFORMED_RESPONSE;
    }
}
