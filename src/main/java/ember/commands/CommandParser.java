package ember.commands;

@FunctionalInterface
public interface CommandParser {
    Command parse(FrameCursor args);
}
