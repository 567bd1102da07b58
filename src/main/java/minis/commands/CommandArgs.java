package minis.commands;

import minis.protocol.RespBulkString;
import minis.protocol.RespValue;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Argument extraction shared by the command handlers.
 */
public final class CommandArgs {
    private CommandArgs() {
    }

    public static boolean isBulkString(RespValue v) {
        return v.getType() == RespValue.Type.BULK_STRING && !v.isNull();
    }

    public static byte[] bytes(List<RespValue> args, int index, String what) {
        RespValue v = args.get(index);
        if (!isBulkString(v)) {
            throw CommandException.invalidRequest(what + " is not a bulk string");
        }
        return ((RespBulkString) v).getBytes();
    }

    public static String string(List<RespValue> args, int index, String what) {
        bytes(args, index, what);
        return ((RespBulkString) args.get(index)).asString();
    }

    /**
     * A store key. Latin-1 maps every byte to one char, so distinct byte
     * sequences always give distinct keys.
     */
    public static String key(List<RespValue> args, int index) {
        return new String(bytes(args, index, "key"), StandardCharsets.ISO_8859_1);
    }
}
