package im.arun.docingest.model;

import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Payload for one call to the recognition service. Exactly one of {@code text} or {@code image} is set.
 */
@Value
public class RecognitionRequest {
    String text;
    EncodedImage image;
    List<ExtractionField> extractionFields;
    List<ExtractionField> tableFields;
    boolean checkedFieldsEnabled;
    String tenantId;

    @Builder
    private RecognitionRequest(String text, EncodedImage image, List<ExtractionField> extractionFields,
                               List<ExtractionField> tableFields, boolean checkedFieldsEnabled, String tenantId) {
        if ((text == null) == (image == null)) {
            throw new IllegalArgumentException("Exactly one of text or image must be provided");
        }
        this.text = text;
        this.image = image;
        this.extractionFields = extractionFields == null ? List.of() : List.copyOf(extractionFields);
        this.tableFields = tableFields == null ? List.of() : List.copyOf(tableFields);
        this.checkedFieldsEnabled = checkedFieldsEnabled;
        this.tenantId = tenantId;
    }

    public static RecognitionRequest forText(String text, ProjectSettings settings) {
        return fromSettings(settings).text(text).build();
    }

    public static RecognitionRequest forImage(EncodedImage image, ProjectSettings settings) {
        return fromSettings(settings).image(image).build();
    }

    private static RecognitionRequestBuilder fromSettings(ProjectSettings settings) {
        return builder()
                .extractionFields(settings.getExtractionFields())
                .tableFields(settings.getTableFields())
                .checkedFieldsEnabled(settings.isCheckedFieldsEnabled())
                .tenantId(settings.getTenantId());
    }

    public boolean isTextMode() {
        return text != null;
    }

    /**
     * Size of the content part of the payload as it goes over the wire (base64 for images).
     */
    public long getPayloadSize() {
        if (text != null) {
            return text.getBytes(StandardCharsets.UTF_8).length;
        }
        return ((long) image.getBytes().length + 2) / 3 * 4;
    }
}
