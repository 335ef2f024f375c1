package ember.commands;

/**
 * A request that is well-formed on the wire but not a valid command: wrong
 * arity, wrong argument kind, bad option syntax. The message is sent to the
 * client as an error reply.
 */
public class CommandException extends RuntimeException {

    public CommandException(String message) {
        super(message);
    }

    public static CommandException wrongArity(String command) {
        return new CommandException("ERR wrong number of arguments for '" + command + "' command");
    }

    public static CommandException syntax() {
        return new CommandException("ERR syntax error");
    }

    public static CommandException notInteger() {
        return new CommandException("ERR value is not an integer or out of range");
    }

    public static CommandException wrongKind(String command, String found) {
        return new CommandException("ERR invalid argument type for '" + command + "' command, expected a string but got " + found);
    }
}
