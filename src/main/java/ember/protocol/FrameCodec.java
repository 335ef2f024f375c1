package ember.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts between wire bytes and {@link Frame} values.
 *
 * <p>Decoding works on a cumulating {@link ByteBuf}: a complete frame is
 * consumed and returned, an incomplete one yields {@code null} with the reader
 * index left where it was, and malformed input raises {@link ProtocolException}.
 */
public final class FrameCodec {

    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte[] CRLF = {CR, LF};

    /** Largest bulk string a client may declare (same limit as Redis). */
    public static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;

    /** Longest header or simple line accepted while still waiting for its CRLF. */
    public static final int MAX_LINE_LENGTH = 64 * 1024;

    /** Deepest array nesting accepted; the parser recurses once per level. */
    public static final int MAX_NESTING_DEPTH = 128;

    private FrameCodec() {
    }

    // --- DECODING ---

    /**
     * Decodes the next frame from {@code in}.
     *
     * @return the frame, or {@code null} if {@code in} does not hold a complete
     *         frame yet (nothing is consumed in that case)
     */
    public static Frame decode(ByteBuf in) throws ProtocolException {
        int start = in.readerIndex();
        Frame frame = parse(in, 0);
        if (frame == null) {
            in.readerIndex(start);
        }
        return frame;
    }

    /** Decodes exactly one frame from a complete byte array. */
    public static Frame decode(byte[] bytes) throws ProtocolException {
        ByteBuf in = Unpooled.wrappedBuffer(bytes);
        Frame frame = decode(in);
        if (frame == null) {
            throw new ProtocolException("incomplete frame");
        }
        if (in.isReadable()) {
            throw new ProtocolException("unexpected trailing bytes after frame");
        }
        return frame;
    }

    private static Frame parse(ByteBuf in, int depth) throws ProtocolException {
        if (!in.isReadable()) return null;

        byte tag = in.readByte();
        Frame.Type type = Frame.Type.fromTag(tag);
        if (type == null) {
            throw new ProtocolException("unknown type tag '" + printable(tag) + "'");
        }

        String line = readLine(in);
        if (line == null) return null;

        switch (type) {
            case SIMPLE_STRING:
                return Frame.simpleString(line);
            case ERROR:
                return Frame.error(line);
            case INTEGER:
                return Frame.integer(parseSigned(line, "integer", Long::parseLong));
            case DOUBLE:
                return Frame.dbl(parseSigned(line, "double", FrameCodec::parseDouble));
            case BOOLEAN:
                if (line.equals("t")) return Frame.bool(true);
                if (line.equals("f")) return Frame.bool(false);
                throw new ProtocolException("invalid boolean '" + line + "'");
            case NULL:
                if (!line.isEmpty()) {
                    throw new ProtocolException("null frame must not carry a payload");
                }
                return Frame.nil();
            case BULK_STRING:
                return parseBulk(in, line);
            case ARRAY:
                return parseArray(in, line, depth);
            default:
                throw new IllegalStateException("unhandled frame type " + type);
        }
    }

    private static Frame parseBulk(ByteBuf in, String header) throws ProtocolException {
        long length = parseSigned(header, "bulk length", Long::parseLong);
        if (length == -1) {
            return Frame.nil();
        }
        if (length < 0 || length > MAX_BULK_LENGTH) {
            throw new ProtocolException("invalid bulk length " + length);
        }
        int len = (int) length;
        if (in.readableBytes() < len + 2) return null;

        int end = in.readerIndex() + len;
        if (in.getByte(end) != CR || in.getByte(end + 1) != LF) {
            throw new ProtocolException("bulk string of declared length " + len + " is not terminated by CRLF");
        }
        byte[] data = new byte[len];
        in.readBytes(data);
        in.skipBytes(2);
        return Frame.bulk(data);
    }

    private static Frame parseArray(ByteBuf in, String header, int depth) throws ProtocolException {
        long count = parseSigned(header, "array length", Long::parseLong);
        if (count < 0 || count > Integer.MAX_VALUE) {
            throw new ProtocolException("invalid array length " + count);
        }
        if (count > 0 && depth >= MAX_NESTING_DEPTH) {
            throw new ProtocolException("arrays nested deeper than " + MAX_NESTING_DEPTH + " levels");
        }
        // Do not trust the declared count for preallocation.
        List<Frame> elements = new ArrayList<>((int) Math.min(count, 16));
        for (long i = 0; i < count; i++) {
            Frame element = parse(in, depth + 1);
            if (element == null) return null;
            elements.add(element);
        }
        return Frame.array(elements);
    }

    /**
     * Reads up to the next CRLF and consumes it.
     *
     * @return the line without terminator, or {@code null} if no CRLF is buffered yet
     */
    private static String readLine(ByteBuf in) throws ProtocolException {
        int from = in.readerIndex();
        int lf = in.indexOf(from, in.writerIndex(), LF);
        if (lf < 0) {
            if (in.readableBytes() > MAX_LINE_LENGTH) {
                throw new ProtocolException("line exceeds " + MAX_LINE_LENGTH + " bytes without CRLF");
            }
            return null;
        }
        if (lf == from || in.getByte(lf - 1) != CR) {
            throw new ProtocolException("line is not terminated by CRLF");
        }
        String line = in.toString(from, lf - 1 - from, StandardCharsets.UTF_8);
        if (line.indexOf('\r') >= 0) {
            throw new ProtocolException("stray CR inside line");
        }
        in.readerIndex(lf + 1);
        return line;
    }

    @FunctionalInterface
    private interface NumberParser<T> {
        T parse(String text);
    }

    /**
     * Shared by integers and doubles: an optional sign followed by a non-empty
     * body, handed whole to {@code parser} so that {@code Long.MIN_VALUE}
     * survives.
     */
    private static <T> T parseSigned(String text, String what, NumberParser<T> parser) throws ProtocolException {
        int bodyStart = 0;
        if (!text.isEmpty() && (text.charAt(0) == '-' || text.charAt(0) == '+')) {
            bodyStart = 1;
        }
        if (bodyStart == text.length()) {
            throw new ProtocolException("invalid " + what + " '" + text + "'");
        }
        char first = text.charAt(bodyStart);
        if (!Character.isDigit(first) && first != 'i' && first != 'n') {
            throw new ProtocolException("invalid " + what + " '" + text + "'");
        }
        try {
            return parser.parse(text);
        } catch (NumberFormatException e) {
            throw new ProtocolException("invalid " + what + " '" + text + "'", e);
        }
    }

    private static double parseDouble(String text) {
        switch (text) {
            case "inf":
            case "+inf":
                return java.lang.Double.POSITIVE_INFINITY;
            case "-inf":
                return java.lang.Double.NEGATIVE_INFINITY;
            case "nan":
            case "+nan":
            case "-nan":
                return java.lang.Double.NaN;
            default:
                // Double.parseDouble also accepts "Infinity", "NaN" and hex literals
                char last = text.charAt(text.length() - 1);
                if (!Character.isDigit(last) && last != '.') {
                    throw new NumberFormatException(text);
                }
                return java.lang.Double.parseDouble(text);
        }
    }

    private static String printable(byte b) {
        return b >= 0x20 && b < 0x7f ? String.valueOf((char) b) : String.format("\\x%02x", b & 0xff);
    }

    // --- ENCODING ---

    public static byte[] encode(Frame frame) {
        ByteBuf out = Unpooled.buffer();
        try {
            encode(frame, out);
            byte[] bytes = new byte[out.readableBytes()];
            out.readBytes(bytes);
            return bytes;
        } finally {
            out.release();
        }
    }

    public static void encode(Frame frame, ByteBuf out) {
        out.writeByte(frame.type().tag());
        switch (frame.type()) {
            case SIMPLE_STRING:
                writeLine(out, ((Frame.SimpleString) frame).text());
                break;
            case ERROR:
                writeLine(out, ((Frame.Error) frame).message());
                break;
            case INTEGER:
                writeLine(out, Long.toString(((Frame.Integer) frame).value()));
                break;
            case DOUBLE:
                writeLine(out, formatDouble(((Frame.Double) frame).value()));
                break;
            case BOOLEAN:
                writeLine(out, ((Frame.Boolean) frame).value() ? "t" : "f");
                break;
            case NULL:
                out.writeBytes(CRLF);
                break;
            case BULK_STRING: {
                byte[] data = ((Frame.BulkString) frame).rawData();
                writeLine(out, Integer.toString(data.length));
                out.writeBytes(data);
                out.writeBytes(CRLF);
                break;
            }
            case ARRAY: {
                List<Frame> elements = ((Frame.Array) frame).elements();
                writeLine(out, Integer.toString(elements.size()));
                for (Frame element : elements) {
                    encode(element, out);
                }
                break;
            }
            default:
                throw new IllegalStateException("unhandled frame type " + frame.type());
        }
    }

    private static void writeLine(ByteBuf out, String line) {
        out.writeCharSequence(line, StandardCharsets.UTF_8);
        out.writeBytes(CRLF);
    }

    private static String formatDouble(double d) {
        if (java.lang.Double.isNaN(d)) return "nan";
        if (java.lang.Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        return java.lang.Double.toString(d);
    }
}
