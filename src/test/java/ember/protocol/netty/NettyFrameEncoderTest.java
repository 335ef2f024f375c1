package ember.protocol.netty;

import ember.protocol.Frame;
import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class NettyFrameEncoderTest {

    private static String writeAndRead(EmbeddedChannel channel, Frame frame) {
        assertTrue(channel.writeOutbound(frame));
        ByteBuf buf = channel.readOutbound();
        try {
            return buf.toString(StandardCharsets.UTF_8);
        } finally {
            buf.release();
        }
    }

    @Test
    public void testEncodeReplies() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyFrameEncoder());

        assertEquals("+OK\r\n", writeAndRead(channel, Frame.simpleString("OK")));
        assertEquals("-ERR syntax error\r\n", writeAndRead(channel, Frame.error("ERR syntax error")));
        assertEquals(":3\r\n", writeAndRead(channel, Frame.integer(3)));
        assertEquals("$5\r\nhello\r\n", writeAndRead(channel, Frame.bulk("hello")));
        assertEquals("_\r\n", writeAndRead(channel, Frame.nil()));
        assertEquals("*2\r\n:1\r\n_\r\n", writeAndRead(channel, Frame.array(Frame.integer(1), Frame.nil())));
        assertFalse(channel.finish());
    }

    @Test
    public void testEncodeBinaryBulk() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyFrameEncoder());
        byte[] payload = {0, (byte) 0x80, '\r', '\n'};

        assertTrue(channel.writeOutbound(Frame.bulk(payload)));
        ByteBuf buf = channel.readOutbound();
        byte[] bytes = new byte[buf.readableBytes()];
        buf.readBytes(bytes);
        buf.release();

        assertArrayEquals(new byte[] {'$', '4', '\r', '\n', 0, (byte) 0x80, '\r', '\n', '\r', '\n'}, bytes);
    }
}
