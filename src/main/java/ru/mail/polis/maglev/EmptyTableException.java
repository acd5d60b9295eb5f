package ru.mail.polis.maglev;

/**
 * Thrown when a key is routed through a table built without nodes.
 */
public class EmptyTableException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public EmptyTableException(String message) {
        super(message);
    }
}
