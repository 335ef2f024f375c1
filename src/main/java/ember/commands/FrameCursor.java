package ember.commands;

import ember.protocol.Frame;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Reads the arguments of a request one at a time.
 *
 * <p>Only simple and bulk strings count as arguments; running out of arguments
 * is an arity error, anything else of the wrong kind is reported as such.
 */
public class FrameCursor {
    private final String commandName;
    private final List<Frame> args;
    private int position = 0;

    /**
     * @param commandName name used in error replies, lower case
     * @param args the request elements after the command name
     */
    public FrameCursor(String commandName, List<Frame> args) {
        this.commandName = commandName;
        this.args = args;
    }

    public boolean hasNext() {
        return position < args.size();
    }

    public byte[] nextBytes() {
        Frame frame = next();
        switch (frame.type()) {
            case BULK_STRING:
                return ((Frame.BulkString) frame).data();
            case SIMPLE_STRING:
                return ((Frame.SimpleString) frame).text().getBytes(StandardCharsets.UTF_8);
            default:
                throw CommandException.wrongKind(commandName, frame.type().name());
        }
    }

    public String nextText() {
        Frame frame = next();
        switch (frame.type()) {
            case BULK_STRING:
                return ((Frame.BulkString) frame).text();
            case SIMPLE_STRING:
                return ((Frame.SimpleString) frame).text();
            default:
                throw CommandException.wrongKind(commandName, frame.type().name());
        }
    }

    public long nextLong() {
        String text = nextText();
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw CommandException.notInteger();
        }
    }

    /** Fails with an arity error if arguments are left over. */
    public void expectEnd() {
        if (hasNext()) throw CommandException.wrongArity(commandName);
    }

    private Frame next() {
        if (!hasNext()) throw CommandException.wrongArity(commandName);
        return args.get(position++);
    }
}
