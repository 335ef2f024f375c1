package ember.commands.string;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.FrameCursor;
import ember.protocol.Frame;

public class GetCommand implements Command {
    private final String key;

    public GetCommand(String key) {
        this.key = key;
    }

    public static GetCommand parse(FrameCursor args) {
        String key = args.nextText();
        args.expectEnd();
        return new GetCommand(key);
    }

    public String getKey() {
        return key;
    }

    @Override
    public Frame execute(ServerContext context) {
        byte[] value = context.getKeyspace().get(key);
        return value == null ? Frame.nil() : Frame.bulk(value);
    }
}
