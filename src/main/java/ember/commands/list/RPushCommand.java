package ember.commands.list;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.FrameCursor;
import ember.protocol.Frame;

import java.util.ArrayList;
import java.util.List;

public class RPushCommand implements Command {
    private final String key;
    private final List<byte[]> values;

    public RPushCommand(String key, List<byte[]> values) {
        this.key = key;
        this.values = values;
    }

    public static RPushCommand parse(FrameCursor args) {
        String key = args.nextText();
        List<byte[]> values = new ArrayList<>();
        values.add(args.nextBytes());
        while (args.hasNext()) values.add(args.nextBytes());
        return new RPushCommand(key, values);
    }

    public String getKey() {
        return key;
    }

    public List<byte[]> getValues() {
        return values;
    }

    @Override
    public Frame execute(ServerContext context) {
        return Frame.integer(context.getKeyspace().pushRight(key, values));
    }
}
