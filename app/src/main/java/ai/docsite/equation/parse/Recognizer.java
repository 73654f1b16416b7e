package ai.docsite.equation.parse;

import java.util.Optional;

/**
 * One rule of the fixed-priority recognizer list. A recognizer inspects the start of the remaining input and either
 * declines or consumes a prefix.
 */
public interface Recognizer {

    String name();

    Optional<Recognition> recognize(String input, ParseContext context);
}
