package minis.commands;

/**
 * A request-level failure. The dispatcher turns it into an error reply and
 * the connection stays open.
 */
public class CommandException extends RuntimeException {

    public enum Kind {
        ARITY,
        SYNTAX,
        UNKNOWN_COMMAND,
        UNKNOWN_CONFIG_PARAM,
        INVALID_REQUEST
    }

    private final Kind kind;

    public CommandException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public static CommandException arity(String command) {
        return new CommandException(Kind.ARITY,
                "wrong number of arguments for '" + command.toLowerCase() + "' command");
    }

    public static CommandException syntax() {
        return new CommandException(Kind.SYNTAX, "syntax error");
    }

    public static CommandException syntax(String detail) {
        return new CommandException(Kind.SYNTAX, detail);
    }

    public static CommandException unknownCommand(String name) {
        return new CommandException(Kind.UNKNOWN_COMMAND, "unknown command: " + name);
    }

    public static CommandException unknownConfigParam(String name) {
        return new CommandException(Kind.UNKNOWN_CONFIG_PARAM, "unknown CONFIG parameter: " + name);
    }

    public static CommandException invalidRequest(String detail) {
        return new CommandException(Kind.INVALID_REQUEST, detail);
    }
}
