package im.arun.docingest.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What the recognition service returned for one logical document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecognitionResult {
    private String text;
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private List<Map<String, Object>> lineItems = new ArrayList<>();
    private String documentType;
    private Double confidence;

    public RecognitionResult(String text, Map<String, Object> metadata, List<Map<String, Object>> lineItems) {
        this(text, metadata, lineItems, null, null);
    }

    @JsonIgnore
    public boolean hasData() {
        return (text != null && !text.isBlank())
                || (metadata != null && !metadata.isEmpty())
                || (lineItems != null && !lineItems.isEmpty());
    }
}
