package im.arun.docingest.ingest;

import im.arun.docingest.model.ProjectSettings;
import im.arun.docingest.model.UploadUnit;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One upload: a single PDF, a single image, or any mix of files, destined for one batch.
 */
@Value
@Builder
public class IngestionRequest {
    String projectId;
    String batchId;
    @Builder.Default ProjectSettings settings = ProjectSettings.builder().build();
    @Singular List<UploadUnit> files;
}
