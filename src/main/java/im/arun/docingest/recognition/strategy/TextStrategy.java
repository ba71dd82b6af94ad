package im.arun.docingest.recognition.strategy;

import im.arun.docingest.model.LogicalDocument;
import im.arun.docingest.model.ProjectSettings;
import im.arun.docingest.model.RecognitionRequest;
import im.arun.docingest.recognition.RecognitionClient;
import im.arun.docingest.recognition.RecognitionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends the document's text layer when it has enough of one. Cheaper and more accurate than OCR on a render.
 */
public class TextStrategy implements RecognitionStrategy {
    private static final Logger logger = LoggerFactory.getLogger(TextStrategy.class);

    private final RecognitionClient client;
    private final int threshold;
    private final int maxRetries;

    public TextStrategy(RecognitionClient client, int threshold, int maxRetries) {
        this.client = client;
        this.threshold = threshold;
        this.maxRetries = maxRetries;
    }

    @Override
    public String name() {
        return "text";
    }

    @Override
    public StrategyOutcome attempt(LogicalDocument unit, ProjectSettings settings) {
        String text = unit.getExtractedText() == null ? "" : unit.getExtractedText().trim();
        if (text.length() < threshold) {
            return StrategyOutcome.skip("text layer has " + text.length() + " characters, below " + threshold);
        }

        RecognitionOutcome outcome = client.recognize(RecognitionRequest.forText(text, settings), maxRetries);
        if (!outcome.isSuccess()) {
            return StrategyOutcome.failure(outcome);
        }
        if (!outcome.getResult().hasData()) {
            logger.info("Text recognition of {} yielded no data, falling back", unit.getName());
            return StrategyOutcome.skip("text recognition yielded no data");
        }
        return StrategyOutcome.result(outcome.getResult(), false, "");
    }
}
