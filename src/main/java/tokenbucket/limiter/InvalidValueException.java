package tokenbucket.limiter;

/**
 * An argument of the right kind but out of range: a rate that is not
 * positive, a capacity below 1, an empty key, or fewer than 1 token requested.
 */
public class InvalidValueException extends IllegalArgumentException {

    public InvalidValueException(String message) {
        super(message);
    }

    public InvalidValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
