package im.arun.docingest.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A caller-declared field the recognition service should extract.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionField {
    private String name;
    private String description;

    public static ExtractionField of(String name) {
        return new ExtractionField(name, null);
    }
}
