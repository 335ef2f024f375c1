package ember.protocol;

/**
 * The bytes on the wire do not form a valid frame. Distinct from an incomplete
 * frame, which the decoder reports by returning {@code null}.
 */
public class ProtocolException extends Exception {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
