package ember.commands.generic;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.FrameCursor;
import ember.protocol.Frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ExistsCommand implements Command {
    private final List<String> keys;

    public ExistsCommand(List<String> keys) {
        this.keys = Collections.unmodifiableList(new ArrayList<>(keys));
    }

    public static ExistsCommand parse(FrameCursor args) {
        List<String> keys = new ArrayList<>();
        keys.add(args.nextText());
        while (args.hasNext()) keys.add(args.nextText());
        return new ExistsCommand(keys);
    }

    public List<String> getKeys() {
        return keys;
    }

    @Override
    public Frame execute(ServerContext context) {
        return Frame.integer(context.getKeyspace().exists(keys));
    }
}
