package ember.commands.server;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.FrameCursor;
import ember.protocol.Frame;
import ember.utils.Log;

import java.io.IOException;

public class SaveCommand implements Command {
    private static final SaveCommand INSTANCE = new SaveCommand();

    public static SaveCommand parse(FrameCursor args) {
        args.expectEnd();
        return INSTANCE;
    }

    @Override
    public Frame execute(ServerContext context) {
        try {
            context.getSnapshotStore().save(context.getKeyspace());
            return Frame.simpleString("OK");
        } catch (IOException e) {
            Log.error("Save failed: " + e);
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return Frame.errorFrom("ERR " + reason);
        }
    }
}
