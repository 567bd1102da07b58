package minis.commands.string;

import minis.ServerContext;
import minis.commands.Command;
import minis.commands.CommandArgs;
import minis.commands.CommandException;
import minis.protocol.RespBulkString;
import minis.protocol.RespValue;

import java.util.List;

public class GetCommand implements Command {
    @Override
    public RespValue execute(ServerContext ctx, List<RespValue> args) {
        if (args.size() != 2) {
            throw CommandException.arity("GET");
        }

        String key = CommandArgs.key(args, 1);
        byte[] value = ctx.getDatabase().getValue(key);
        return value == null ? RespBulkString.NULL : RespBulkString.of(value);
    }
}
