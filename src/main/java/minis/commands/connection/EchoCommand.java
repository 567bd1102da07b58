package minis.commands.connection;

import minis.ServerContext;
import minis.commands.Command;
import minis.commands.CommandArgs;
import minis.commands.CommandException;
import minis.protocol.RespValue;

import java.util.List;

public class EchoCommand implements Command {
    @Override
    public RespValue execute(ServerContext ctx, List<RespValue> args) {
        // A non-string message counts as a missing one
        if (args.size() != 2 || !CommandArgs.isBulkString(args.get(1))) {
            throw CommandException.arity("ECHO");
        }
        return args.get(1);
    }
}
