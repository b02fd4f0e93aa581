package tokenbucket.limiter;

/**
 * An argument of the wrong kind: a missing value, a rate that is not a number,
 * a capacity that is not an integer, or a storage that does not implement
 * {@link tokenbucket.core.storage.Storage}.
 */
public class InvalidTypeException extends IllegalArgumentException {

    public InvalidTypeException(String message) {
        super(message);
    }

    public InvalidTypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
