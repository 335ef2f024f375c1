package ember.commands.string;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.FrameCursor;
import ember.protocol.Frame;

/**
 * INCR key. The read-modify-write happens inside the keyspace so it is atomic.
 */
public class IncrCommand implements Command {
    private final String key;

    public IncrCommand(String key) {
        this.key = key;
    }

    public static IncrCommand parse(FrameCursor args) {
        String key = args.nextText();
        args.expectEnd();
        return new IncrCommand(key);
    }

    public String getKey() {
        return key;
    }

    @Override
    public Frame execute(ServerContext context) {
        return Frame.integer(context.getKeyspace().increment(key));
    }
}
