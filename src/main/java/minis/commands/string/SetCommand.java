package minis.commands.string;

import minis.ServerContext;
import minis.commands.Command;
import minis.commands.CommandArgs;
import minis.commands.CommandException;
import minis.protocol.RespSimpleString;
import minis.protocol.RespValue;

import java.util.List;

/**
 * {@code SET key value [PX milliseconds]}
 */
public class SetCommand implements Command {
    @Override
    public RespValue execute(ServerContext ctx, List<RespValue> args) {
        if (args.size() < 3) {
            throw CommandException.arity("SET");
        }
        if (args.size() != 3 && args.size() != 5) {
            throw CommandException.syntax();
        }

        String key = CommandArgs.key(args, 1);
        byte[] val = CommandArgs.bytes(args, 2, "value");

        long ttlMillis = -1;
        if (args.size() == 5) {
            String option = CommandArgs.string(args, 3, "option");
            if (!option.equalsIgnoreCase("PX")) {
                throw CommandException.syntax();
            }
            ttlMillis = parseTtl(CommandArgs.string(args, 4, "expire time"));
        }

        ctx.getDatabase().set(key, val, ttlMillis);
        return RespSimpleString.OK;
    }

    private static long parseTtl(String s) {
        // Digits only: no sign, no whitespace
        if (s.isEmpty()) {
            throw CommandException.syntax("invalid expire time in 'set' command");
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                throw CommandException.syntax("invalid expire time in 'set' command");
            }
        }
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw CommandException.syntax("invalid expire time in 'set' command");
        }
    }
}
