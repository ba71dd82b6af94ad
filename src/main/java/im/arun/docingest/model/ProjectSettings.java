package im.arun.docingest.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Per-project extraction schema and separation policy applied to every file of a run.
 */
@Value
@Builder
public class ProjectSettings {
    @Singular List<ExtractionField> extractionFields;
    @Singular List<ExtractionField> tableFields;
    boolean checkedFieldsEnabled;
    @Builder.Default SeparationPolicy separationPolicy = SeparationPolicy.none();
    String tenantId;
}
