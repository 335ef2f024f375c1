package ember.commands.string;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.CommandException;
import ember.commands.FrameCursor;
import ember.db.Expiry;
import ember.protocol.Frame;
import ember.utils.Time;

import java.util.Locale;

/**
 * SET key value [EX seconds | PX millis | EXAT unix-seconds | PXAT unix-millis] [GET]
 *
 * <p>Replaces any existing value and expiry. With GET the reply is the previous
 * value (or null) instead of OK.
 */
public class SetCommand implements Command {
    private final String key;
    private final byte[] value;
    private final Expiry expiry;
    private final boolean get;

    public SetCommand(String key, byte[] value, Expiry expiry, boolean get) {
        this.key = key;
        this.value = value;
        this.expiry = expiry;
        this.get = get;
    }

    public static SetCommand parse(FrameCursor args) {
        String key = args.nextText();
        byte[] value = args.nextBytes();
        Expiry expiry = null;
        boolean get = false;

        while (args.hasNext()) {
            String option = args.nextText().toUpperCase(Locale.ROOT);
            switch (option) {
                case "EX":
                case "PX":
                case "EXAT":
                case "PXAT":
                    if (expiry != null || !args.hasNext()) throw CommandException.syntax();
                    expiry = parseExpiry(option, args.nextLong());
                    break;
                case "GET":
                    if (get) throw CommandException.syntax();
                    get = true;
                    break;
                default:
                    throw CommandException.syntax();
            }
        }
        return new SetCommand(key, value, expiry, get);
    }

    private static Expiry parseExpiry(String option, long amount) {
        if (amount <= 0) throw invalidExpireTime();
        long millis;
        try {
            millis = option.startsWith("E") ? Math.multiplyExact(amount, 1000L) : amount;
        } catch (ArithmeticException e) {
            throw invalidExpireTime();
        }
        long now = Time.now();
        if (option.endsWith("AT")) {
            if (millis <= now) {
                throw new CommandException("ERR expiration must be in the future");
            }
            return Expiry.at(millis);
        }
        if (millis > Long.MAX_VALUE - now) throw invalidExpireTime();
        return Expiry.in(millis);
    }

    private static CommandException invalidExpireTime() {
        return new CommandException("ERR invalid expire time in 'set' command");
    }

    public String getKey() {
        return key;
    }

    public byte[] getValue() {
        return value;
    }

    /** Null when the key is stored without expiry. */
    public Expiry getExpiry() {
        return expiry;
    }

    public boolean isGet() {
        return get;
    }

    @Override
    public Frame execute(ServerContext context) {
        byte[] previous = context.getKeyspace().set(key, value, expiry);
        if (get) {
            return previous == null ? Frame.nil() : Frame.bulk(previous);
        }
        return Frame.simpleString("OK");
    }
}
