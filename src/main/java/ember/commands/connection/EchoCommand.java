package ember.commands.connection;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.FrameCursor;
import ember.protocol.Frame;

public class EchoCommand implements Command {
    private final byte[] message;

    public EchoCommand(byte[] message) {
        this.message = message;
    }

    public static EchoCommand parse(FrameCursor args) {
        byte[] message = args.nextBytes();
        args.expectEnd();
        return new EchoCommand(message);
    }

    @Override
    public Frame execute(ServerContext context) {
        return Frame.bulk(message);
    }
}
