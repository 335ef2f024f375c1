package ember.commands.string;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.FrameCursor;
import ember.protocol.Frame;

public class DecrCommand implements Command {
    private final String key;

    public DecrCommand(String key) {
        this.key = key;
    }

    public static DecrCommand parse(FrameCursor args) {
        String key = args.nextText();
        args.expectEnd();
        return new DecrCommand(key);
    }

    public String getKey() {
        return key;
    }

    @Override
    public Frame execute(ServerContext context) {
        return Frame.integer(context.getKeyspace().decrement(key));
    }
}
