package ember.commands;

import ember.ServerContext;
import ember.protocol.Frame;

public class UnknownCommand implements Command {
    private final String name;

    public UnknownCommand(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public Frame execute(ServerContext context) {
        return Frame.errorFrom("ERR unknown command '" + name + "'");
    }
}
