package minis.commands;

import minis.MinisServerContext;
import minis.protocol.RespArray;
import minis.protocol.RespBulkString;
import minis.protocol.RespError;
import minis.protocol.RespValue;
import minis.utils.Log;

import java.util.List;

/**
 * Routes a decoded request to its command and returns the reply.
 * Never throws: every failure becomes an error reply so the connection can continue.
 */
public class CommandDispatcher {
    private final MinisServerContext context;
    private final CommandRegistry registry;

    public CommandDispatcher(MinisServerContext context) {
        this(context, CommandRegistry.withDefaults());
    }

    public CommandDispatcher(MinisServerContext context, CommandRegistry registry) {
        this.context = context;
        this.registry = registry;
    }

    public RespValue dispatch(RespValue request) {
        context.commandProcessed();
        String name = null;
        try {
            List<RespValue> parts = requestParts(request);
            name = ((RespBulkString) parts.get(0)).asString();

            Command cmd = registry.get(name);
            if (cmd == null) {
                throw CommandException.unknownCommand(name);
            }
            return cmd.execute(context, parts);
        } catch (CommandException e) {
            Log.debug("Command " + name + " rejected: " + e.getMessage());
            return new RespError("ERR " + e.getMessage());
        } catch (RuntimeException e) {
            Log.error("Command " + name + " failed", e);
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return new RespError("ERR " + msg);
        }
    }

    private static List<RespValue> requestParts(RespValue request) {
        if (request.getType() != RespValue.Type.ARRAY || request.isNull()) {
            throw CommandException.invalidRequest("request must be an array of bulk strings");
        }
        List<RespValue> parts = ((RespArray) request).getElements();
        if (parts.isEmpty()) {
            throw CommandException.invalidRequest("empty request");
        }
        if (!CommandArgs.isBulkString(parts.get(0))) {
            throw CommandException.invalidRequest("command name is not a bulk string");
        }
        return parts;
    }
}
