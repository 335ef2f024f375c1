package ember.commands.connection;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.FrameCursor;
import ember.protocol.Frame;

public class PingCommand implements Command {
    private static final Frame PONG = Frame.simpleString("PONG");

    private final byte[] message;

    public PingCommand(byte[] message) {
        this.message = message;
    }

    public static PingCommand parse(FrameCursor args) {
        byte[] message = args.hasNext() ? args.nextBytes() : null;
        args.expectEnd();
        return new PingCommand(message);
    }

    public byte[] getMessage() {
        return message;
    }

    @Override
    public Frame execute(ServerContext context) {
        return message == null ? PONG : Frame.bulk(message);
    }
}
