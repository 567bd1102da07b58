package minis.commands;

import minis.commands.connection.EchoCommand;
import minis.commands.connection.PingCommand;
import minis.commands.server.ConfigCommand;
import minis.commands.string.GetCommand;
import minis.commands.string.SetCommand;

import java.util.HashMap;
import java.util.Map;

/**
 * Command name to handler table. Names are matched case-sensitively.
 * Populate it before handing it to a dispatcher; lookups are not synchronized.
 */
public class CommandRegistry {
    private final Map<String, Command> commands = new HashMap<>();

    public static CommandRegistry withDefaults() {
        CommandRegistry registry = new CommandRegistry();
        // Connection
        registry.register("PING", new PingCommand());
        registry.register("ECHO", new EchoCommand());

        // String
        registry.register("SET", new SetCommand());
        registry.register("GET", new GetCommand());

        // Server
        registry.register("CONFIG", new ConfigCommand());
        return registry;
    }

    public void register(String name, Command command) {
        commands.put(name, command);
    }

    public Command get(String name) {
        return commands.get(name);
    }
}
