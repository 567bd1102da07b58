package minis.commands.server;

import minis.Config;
import minis.MinisServerContext;
import minis.commands.CommandDispatcher;
import minis.db.MinisDatabase;
import minis.protocol.RespArray;
import minis.protocol.RespBulkString;
import minis.protocol.RespError;
import minis.protocol.RespSimpleString;
import minis.protocol.RespValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigCommandTest {

    private Config config;
    private MinisServerContext context;
    private ConfigCommand cmd;

    @BeforeEach
    public void setup() {
        config = new Config();
        config.dir = "/tmp/minis";
        config.dbfilename = "dump.rdb";
        context = new MinisServerContext(new MinisDatabase(), config);
        cmd = new ConfigCommand();
    }

    private RespValue run(String... args) {
        return cmd.execute(context, RespArray.ofBulkStrings(args).getElements());
    }

    @Test
    public void testGetKnownParams() {
        assertEquals(RespBulkString.of("/tmp/minis"), run("CONFIG", "GET", "dir"));
        assertEquals(RespBulkString.of("dump.rdb"), run("CONFIG", "GET", "dbfilename"));
        assertEquals(RespBulkString.of("dump.rdb"), run("CONFIG", "GET", "DBFILENAME"));
    }

    @Test
    public void testGetUnknownParamIsNull() {
        assertSame(RespBulkString.NULL, run("CONFIG", "GET", "maxmemory"));
    }

    @Test
    public void testSetThenGet() {
        assertEquals(RespSimpleString.OK, run("CONFIG", "SET", "dir", "/var/lib/minis"));
        assertEquals(RespSimpleString.OK, run("CONFIG", "SET", "dbfilename", "snap.rdb"));

        assertEquals("/var/lib/minis", config.dir);
        assertEquals(RespBulkString.of("snap.rdb"), run("CONFIG", "GET", "dbfilename"));
    }

    @Test
    public void testSetUnknownParamThroughDispatcher() {
        RespValue reply = new CommandDispatcher(context)
                .dispatch(RespArray.ofBulkStrings("CONFIG", "SET", "port", "1"));
        assertEquals(new RespError("ERR unknown CONFIG parameter: port"), reply);
    }

    @Test
    public void testBadShapes() {
        CommandDispatcher dispatcher = new CommandDispatcher(context);
        assertEquals(RespValue.Type.ERROR, dispatcher.dispatch(RespArray.ofBulkStrings("CONFIG")).getType());
        assertEquals(RespValue.Type.ERROR, dispatcher.dispatch(RespArray.ofBulkStrings("CONFIG", "GET")).getType());
        assertEquals(RespValue.Type.ERROR, dispatcher.dispatch(RespArray.ofBulkStrings("CONFIG", "SET", "dir")).getType());
        assertEquals(RespValue.Type.ERROR, dispatcher.dispatch(RespArray.ofBulkStrings("CONFIG", "RESETSTAT")).getType());
        assertEquals("/tmp/minis", config.dir);
    }
}
