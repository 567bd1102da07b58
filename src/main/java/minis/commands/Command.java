package minis.commands;

import minis.ServerContext;
import minis.protocol.RespValue;

import java.util.List;

public interface Command {
    // Executes the command and returns the reply to encode.
    // args.get(0) is the command name as sent by the client.
    // Failures the client should see are thrown as CommandException.
    RespValue execute(ServerContext ctx, List<RespValue> args);
}
