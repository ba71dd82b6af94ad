package im.arun.docingest.recognition;

import im.arun.docingest.model.LogicalDocument;
import im.arun.docingest.model.ProjectSettings;
import im.arun.docingest.recognition.strategy.RecognitionStrategy;
import im.arun.docingest.recognition.strategy.StrategyOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs strategies in order until one produces a result or fails. Never returns a skip.
 */
public class StrategyChain {
    private static final Logger logger = LoggerFactory.getLogger(StrategyChain.class);

    private final List<RecognitionStrategy> strategies;

    public StrategyChain(List<RecognitionStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one recognition strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    public StrategyOutcome recognize(LogicalDocument unit, ProjectSettings settings) {
        List<String> skipped = new ArrayList<>();
        for (RecognitionStrategy strategy : strategies) {
            StrategyOutcome outcome = strategy.attempt(unit, settings);
            if (!outcome.isSkip()) {
                logger.debug("{}: strategy {} finished with {}", unit.getName(), strategy.name(), outcome.getType());
                return outcome;
            }
            logger.debug("{}: strategy {} skipped ({})", unit.getName(), strategy.name(), outcome.getMessage());
            skipped.add(strategy.name() + ": " + outcome.getMessage());
        }
        return StrategyOutcome.failure(FailureCause.NO_DATA, "No recognition strategy produced data (" + String.join("; ", skipped) + ")");
    }
}
