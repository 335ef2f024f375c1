package ember.db;

/**
 * The stored value cannot take part in the requested operation (INCR on text,
 * LPUSH on something that is not a list). The value is left as it was.
 */
public class ValueTypeException extends RuntimeException {

    public static final String NOT_AN_INTEGER = "ERR value is not an integer or out of range";
    public static final String OVERFLOW = "ERR increment or decrement would overflow";
    public static final String WRONG_TYPE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    public ValueTypeException(String message) {
        super(message);
    }

    public ValueTypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
