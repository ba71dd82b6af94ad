package im.arun.docingest.recognition.strategy;

import im.arun.docingest.model.LogicalDocument;
import im.arun.docingest.model.ProjectSettings;

/**
 * One way of getting a recognition result for a logical document.
 */
public interface RecognitionStrategy {

    String name();

    StrategyOutcome attempt(LogicalDocument unit, ProjectSettings settings);
}
