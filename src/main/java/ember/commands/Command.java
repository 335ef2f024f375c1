package ember.commands;

import ember.ServerContext;
import ember.protocol.Frame;

/**
 * A parsed request. Arguments are validated when the command is built, so
 * {@link #execute} only deals with the keyspace.
 */
public interface Command {
    // Returns the reply to send back to the client.
    Frame execute(ServerContext context);
}
