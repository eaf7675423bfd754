package me.christianrobert.camlbuilder.caml.context;

/**
 * Exception thrown when a CAML node cannot be built from the given arguments.
 * Captures the element (field name, node kind) that was being built.
 *
 * <p>Thrown eagerly by constructors and factories, never by rendering.
 */
public class CamlBuildException extends IllegalArgumentException {

    private final String element;

    public CamlBuildException(String message) {
        super(message);
        this.element = null;
    }

    public CamlBuildException(String message, Throwable cause) {
        super(message, cause);
        this.element = null;
    }

    public CamlBuildException(String message, String element) {
        super(message);
        this.element = element;
    }

    public CamlBuildException(String message, String element, Throwable cause) {
        super(message, cause);
        this.element = element;
    }

    public String getElement() {
        return element;
    }

    /**
     * Gets a detailed error message including the element being built.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (element != null) {
            sb.append("\nElement: ").append(element);
        }
        if (getCause() != null && getCause().getMessage() != null) {
            sb.append("\nCause: ").append(getCause().getMessage());
        }
        return sb.toString();
    }
}
