package ember.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * Lists live in the keyspace as ordinary values: a JSON array whose elements
 * are the base64 form of each byte string.
 */
public final class ListCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<byte[]>> LIST_OF_BYTES = new TypeReference<List<byte[]>>() { };

    private ListCodec() {
    }

    public static byte[] encode(Collection<byte[]> elements) {
        try {
            return MAPPER.writeValueAsBytes(elements);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode list value", e);
        }
    }

    /**
     * @throws ValueTypeException if {@code value} is not an encoded list
     */
    public static List<byte[]> decode(byte[] value) {
        List<byte[]> elements;
        try {
            elements = MAPPER.readValue(value, LIST_OF_BYTES);
        } catch (IOException e) {
            throw new ValueTypeException(ValueTypeException.WRONG_TYPE, e);
        }
        if (elements == null || elements.contains(null)) {
            throw new ValueTypeException(ValueTypeException.WRONG_TYPE);
        }
        return elements;
    }
}
