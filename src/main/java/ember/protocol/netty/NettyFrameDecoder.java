package ember.protocol.netty;

import ember.protocol.Frame;
import ember.protocol.FrameCodec;
import ember.protocol.ProtocolException;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * Turns the inbound byte stream into {@link Frame}s.
 *
 * <p>Netty keeps the cumulation buffer between reads, so an incomplete frame
 * simply waits for the next read. On malformed input the buffered bytes are
 * dropped (there is no reliable way to resynchronise inside them) and the
 * {@link ProtocolException} is rethrown; Netty hands it to the next handler's
 * {@code exceptionCaught} wrapped in a {@code DecoderException}.
 */
public class NettyFrameDecoder extends ByteToMessageDecoder {

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        while (in.isReadable()) {
            Frame frame;
            try {
                frame = FrameCodec.decode(in);
            } catch (ProtocolException e) {
                in.skipBytes(in.readableBytes());
                throw e;
            }
            if (frame == null) return; // Wait for more data
            out.add(frame);
        }
    }
}
