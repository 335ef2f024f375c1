package ember.commands;

import ember.commands.connection.*;
import ember.commands.generic.*;
import ember.commands.list.*;
import ember.commands.server.*;
import ember.commands.string.*;
import ember.protocol.Frame;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps command names to their parsers and turns request frames into commands.
 */
public class CommandRegistry {
    private static final Map<String, CommandParser> commands = new HashMap<>();

    static {
        // Connection
        register("PING", PingCommand::parse);
        register("ECHO", EchoCommand::parse);

        // String
        register("GET", GetCommand::parse);
        register("SET", SetCommand::parse);
        register("INCR", IncrCommand::parse);
        register("DECR", DecrCommand::parse);

        // Generic
        register("DEL", DelCommand::parse);
        register("EXISTS", ExistsCommand::parse);

        // List
        register("LPUSH", LPushCommand::parse);
        register("RPUSH", RPushCommand::parse);

        // Server
        register("SAVE", SaveCommand::parse);
    }

    public static void register(String name, CommandParser parser) {
        commands.put(name.toUpperCase(Locale.ROOT), parser);
    }

    public static boolean isRegistered(String name) {
        return commands.containsKey(name.toUpperCase(Locale.ROOT));
    }

    /**
     * Interprets a request frame. Unregistered names yield an
     * {@link UnknownCommand} rather than an exception.
     *
     * @throws CommandException if the frame is not a request or its arguments
     *         do not fit the command
     */
    public static Command parse(Frame request) {
        if (request.type() != Frame.Type.ARRAY) {
            throw new CommandException("ERR Protocol error: expected an array of bulk strings, got " + request.type().name());
        }
        List<Frame> parts = ((Frame.Array) request).elements();
        if (parts.isEmpty()) {
            throw new CommandException("ERR missing command name");
        }

        Frame first = parts.get(0);
        String name;
        if (first.type() == Frame.Type.BULK_STRING) {
            name = ((Frame.BulkString) first).text();
        } else if (first.type() == Frame.Type.SIMPLE_STRING) {
            name = ((Frame.SimpleString) first).text();
        } else {
            throw new CommandException("ERR command name must be a string, got " + first.type().name());
        }

        CommandParser parser = commands.get(name.toUpperCase(Locale.ROOT));
        if (parser == null) {
            return new UnknownCommand(name);
        }
        FrameCursor args = new FrameCursor(name.toLowerCase(Locale.ROOT), parts.subList(1, parts.size()));
        return parser.parse(args);
    }
}
