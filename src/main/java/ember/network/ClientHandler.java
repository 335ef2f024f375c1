package ember.network;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.CommandException;
import ember.commands.CommandRegistry;
import ember.commands.UnknownCommand;
import ember.db.ValueTypeException;
import ember.protocol.Frame;
import ember.protocol.ProtocolException;
import ember.utils.Log;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.DecoderException;

import java.io.IOException;

/**
 * Serves one client connection: every decoded frame is parsed into a command,
 * executed against the shared keyspace and answered with exactly one reply,
 * flushed before the next request is looked at.
 *
 * <p>Bad frames and bad commands are answered with an error reply and the
 * connection stays open. A malformed frame takes the rest of the bytes read
 * with it: requests pipelined behind it in the same read get no reply, since
 * there is no safe point to resume parsing inside them. I/O failures close
 * this connection only.
 */
public class ClientHandler extends ChannelInboundHandlerAdapter {
    private final ServerContext context;
    private ChannelHandlerContext ctx;

    public ClientHandler(ServerContext context) {
        this.context = context;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        this.ctx = ctx;
        context.clientConnected();
        if (Log.isDebugEnabled()) {
            Log.debug("Client connected: " + getRemoteAddress() + " (" + context.getActiveConnections() + " active)");
        }
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        context.clientDisconnected();
        Log.debug("Client disconnected: " + getRemoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (msg instanceof Frame) {
            ctx.writeAndFlush(handleRequest((Frame) msg));
        } else {
            ctx.fireChannelRead(msg);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException && cause.getCause() instanceof ProtocolException) {
            Log.debug("Protocol error from " + getRemoteAddress() + ": " + cause.getCause().getMessage());
            ctx.writeAndFlush(Frame.errorFrom("ERR Protocol error: " + cause.getCause().getMessage()));
            return;
        }
        if (cause instanceof IOException) {
            Log.debug("Closing " + getRemoteAddress() + ": " + cause.getMessage());
        } else {
            Log.warn("Closing " + getRemoteAddress() + " after unexpected error", cause);
        }
        ctx.close();
    }

    /**
     * Turns one request into its reply. Never throws for a bad request; the
     * failure becomes an error frame.
     */
    public Frame handleRequest(Frame request) {
        context.commandProcessed();
        try {
            Command command = CommandRegistry.parse(request);
            if (command instanceof UnknownCommand) {
                Log.debug("Unknown command '" + ((UnknownCommand) command).getName() + "' from " + getRemoteAddress());
            }
            return command.execute(context);
        } catch (CommandException | ValueTypeException e) {
            return Frame.errorFrom(e.getMessage());
        } catch (RuntimeException e) {
            Log.warn("Command failed: " + request, e);
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return Frame.errorFrom("ERR " + reason);
        }
    }

    public String getRemoteAddress() {
        if (ctx != null && ctx.channel().remoteAddress() != null) {
            return ctx.channel().remoteAddress().toString();
        }
        return "0.0.0.0:0";
    }
}
