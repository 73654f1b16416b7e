package ai.docsite.equation.omml;

/**
 * Runtime exception for failures while building or printing OMML markup.
 */
public class OmmlSerializationException extends RuntimeException {

    public OmmlSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
