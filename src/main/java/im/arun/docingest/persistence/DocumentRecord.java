package im.arun.docingest.persistence;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * A recognised document as handed to the {@link PersistenceGateway}.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentRecord {
    String batchId;
    String projectId;
    String name;
    String mimeType;
    int ordinal;
    int startPage;
    int endPage;
    /** Data URL of the image sent for recognition, empty for text-mode documents. */
    String contentRef;
    String text;
    Map<String, Object> metadata;
    List<Map<String, Object>> lineItems;
    String documentType;
    Double confidence;
}
