package ember.commands.string;

import ember.EmberServerContext;
import ember.commands.CommandException;
import ember.commands.CommandRegistry;
import ember.db.Expiry;
import ember.db.Keyspace;
import ember.persistence.SnapshotStore;
import ember.protocol.Frame;
import ember.utils.Time;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class SetCommandTest {

    private static final long NOW = 1_700_000_000_000L;

    @TempDir
    Path tempDir;

    private Keyspace keyspace;
    private EmberServerContext context;

    @BeforeEach
    public void setup() {
        Time.setClock(Time.fixed(NOW));
        keyspace = new Keyspace();
        context = new EmberServerContext(keyspace, new SnapshotStore(tempDir.resolve("dump.json")));
    }

    @AfterEach
    public void tearDown() {
        keyspace.close();
        Time.useSystemClock();
    }

    private static SetCommand parse(String... parts) {
        return (SetCommand) CommandRegistry.parse(Frame.command(parts));
    }

    private static String errorOf(String... parts) {
        return assertThrows(CommandException.class, () -> CommandRegistry.parse(Frame.command(parts))).getMessage();
    }

    @Test
    public void testPlainSet() {
        SetCommand cmd = parse("SET", "k", "v");
        assertEquals("k", cmd.getKey());
        assertArrayEquals("v".getBytes(StandardCharsets.UTF_8), cmd.getValue());
        assertNull(cmd.getExpiry());
        assertFalse(cmd.isGet());

        assertEquals(Frame.simpleString("OK"), cmd.execute(context));
        assertArrayEquals("v".getBytes(StandardCharsets.UTF_8), keyspace.get("k"));
    }

    @Test
    public void testExpiryOptions() {
        assertEquals(Expiry.at(NOW + 10_000), parse("SET", "k", "v", "EX", "10").getExpiry());
        assertEquals(Expiry.at(NOW + 1500), parse("SET", "k", "v", "px", "1500").getExpiry());
        assertEquals(Expiry.at((NOW / 1000 + 60) * 1000), parse("SET", "k", "v", "EXAT", Long.toString(NOW / 1000 + 60)).getExpiry());
        assertEquals(Expiry.at(NOW + 1), parse("SET", "k", "v", "PXAT", Long.toString(NOW + 1)).getExpiry());
    }

    @Test
    public void testGetOption() {
        assertEquals(Frame.nil(), parse("SET", "k", "first", "GET").execute(context));
        assertEquals(Frame.bulk("first"), parse("SET", "k", "second", "get", "EX", "100").execute(context));
        assertArrayEquals("second".getBytes(StandardCharsets.UTF_8), keyspace.get("k"));
    }

    @Test
    public void testSetWithoutExpiryClearsTtl() {
        parse("SET", "k", "v", "EX", "100").execute(context);
        assertEquals(Long.valueOf(NOW + 100_000), keyspace.expireAt("k"));

        parse("SET", "k", "v2").execute(context);
        assertNull(keyspace.expireAt("k"));
    }

    @Test
    public void testInvalidExpireTime() {
        assertEquals("ERR invalid expire time in 'set' command", errorOf("SET", "k", "v", "EX", "0"));
        assertEquals("ERR invalid expire time in 'set' command", errorOf("SET", "k", "v", "PX", "-5"));
        assertEquals("ERR invalid expire time in 'set' command", errorOf("SET", "k", "v", "EX", Long.toString(Long.MAX_VALUE / 10)));
        assertEquals("ERR invalid expire time in 'set' command", errorOf("SET", "k", "v", "EXAT", "0"));
    }

    @Test
    public void testAbsoluteExpiryMustBeInTheFuture() {
        assertEquals("ERR expiration must be in the future", errorOf("SET", "k", "v", "PXAT", Long.toString(NOW)));
        assertEquals("ERR expiration must be in the future", errorOf("SET", "k", "v", "EXAT", "1"));
        assertNull(keyspace.get("k"));
    }

    @Test
    public void testSyntaxErrors() {
        assertEquals("ERR syntax error", errorOf("SET", "k", "v", "EX"));
        assertEquals("ERR syntax error", errorOf("SET", "k", "v", "EX", "10", "PX", "100"));
        assertEquals("ERR syntax error", errorOf("SET", "k", "v", "NX"));
        assertEquals("ERR syntax error", errorOf("SET", "k", "v", "GET", "GET"));
    }

    @Test
    public void testNonNumericExpiry() {
        assertEquals("ERR value is not an integer or out of range", errorOf("SET", "k", "v", "EX", "abc"));
        assertEquals("ERR value is not an integer or out of range", errorOf("SET", "k", "v", "PX", "1.5"));
    }
}
