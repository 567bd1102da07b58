package minis.commands.connection;

import minis.ServerContext;
import minis.commands.Command;
import minis.commands.CommandArgs;
import minis.commands.CommandException;
import minis.protocol.RespBulkString;
import minis.protocol.RespSimpleString;
import minis.protocol.RespValue;

import java.util.List;

public class PingCommand implements Command {
    @Override
    public RespValue execute(ServerContext ctx, List<RespValue> args) {
        if (args.size() > 2) {
            throw CommandException.arity("PING");
        }
        if (args.size() == 2) {
            return RespBulkString.of(CommandArgs.bytes(args, 1, "message"));
        }
        return RespSimpleString.PONG;
    }
}
