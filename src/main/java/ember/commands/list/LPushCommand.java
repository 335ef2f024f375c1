package ember.commands.list;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.FrameCursor;
import ember.protocol.Frame;

import java.util.ArrayList;
import java.util.List;

/**
 * LPUSH key value [value ...]. Values are pushed to the head one after the
 * other, so the last argument ends up first.
 */
public class LPushCommand implements Command {
    private final String key;
    private final List<byte[]> values;

    public LPushCommand(String key, List<byte[]> values) {
        this.key = key;
        this.values = values;
    }

    public static LPushCommand parse(FrameCursor args) {
        String key = args.nextText();
        List<byte[]> values = new ArrayList<>();
        values.add(args.nextBytes());
        while (args.hasNext()) values.add(args.nextBytes());
        return new LPushCommand(key, values);
    }

    public String getKey() {
        return key;
    }

    public List<byte[]> getValues() {
        return values;
    }

    @Override
    public Frame execute(ServerContext context) {
        return Frame.integer(context.getKeyspace().pushLeft(key, values));
    }
}
