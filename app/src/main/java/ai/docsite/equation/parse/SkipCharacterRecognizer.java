package ai.docsite.equation.parse;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last resort: drops exactly one character so that parsing always makes progress.
 */
final class SkipCharacterRecognizer implements Recognizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SkipCharacterRecognizer.class);

    @Override
    public String name() {
        return "skip";
    }

    @Override
    public Optional<Recognition> recognize(String input, ParseContext context) {
        if (input.isEmpty()) {
            return Optional.empty();
        }
        LOGGER.debug("Dropping unrecognized character '{}' at depth {}", input.charAt(0), context.depth());
        return Optional.of(Recognition.skip(1));
    }
}
