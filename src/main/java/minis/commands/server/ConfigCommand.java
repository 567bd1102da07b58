package minis.commands.server;

import minis.Config;
import minis.ServerContext;
import minis.commands.Command;
import minis.commands.CommandArgs;
import minis.commands.CommandException;
import minis.protocol.RespBulkString;
import minis.protocol.RespSimpleString;
import minis.protocol.RespValue;

import java.util.List;

/**
 * {@code CONFIG GET param} and {@code CONFIG SET param value} for the
 * {@code dir} and {@code dbfilename} parameters.
 */
public class ConfigCommand implements Command {
    @Override
    public RespValue execute(ServerContext ctx, List<RespValue> args) {
        if (args.size() < 2) {
            throw CommandException.arity("CONFIG");
        }

        String sub = CommandArgs.string(args, 1, "subcommand");

        switch (sub) {
            case "GET":
                return handleGet(ctx.getConfig(), args);
            case "SET":
                return handleSet(ctx.getConfig(), args);
            default:
                throw CommandException.syntax("unknown CONFIG subcommand: " + sub);
        }
    }

    private RespValue handleGet(Config config, List<RespValue> args) {
        if (args.size() != 3) {
            throw CommandException.arity("CONFIG|GET");
        }

        String param = CommandArgs.string(args, 2, "parameter");
        return RespBulkString.of(config.getParameter(param));
    }

    private RespValue handleSet(Config config, List<RespValue> args) {
        if (args.size() != 4) {
            throw CommandException.arity("CONFIG|SET");
        }

        String param = CommandArgs.string(args, 2, "parameter");
        String value = CommandArgs.string(args, 3, "value");
        if (!config.setParameter(param, value)) {
            throw CommandException.unknownConfigParam(param);
        }
        return RespSimpleString.OK;
    }
}
