package minis;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

    @TempDir
    Path tempDir;

    @Test
    public void testDefaultsWhenFileMissing() {
        Config config = Config.load(tempDir.resolve("nope.yaml").toString());
        assertEquals(6379, config.port);
        assertEquals("", config.dir);
        assertEquals("dump.rdb", config.dbfilename);
    }

    @Test
    public void testLoadYaml() throws IOException {
        Path file = tempDir.resolve("minis.yaml");
        Files.write(file, ("port: 7001\n" +
                "dir: /data\n" +
                "dbfilename: snap.rdb\n" +
                "unknown: ignored\n").getBytes(StandardCharsets.UTF_8));

        Config config = Config.load(file.toString());
        assertEquals(7001, config.port);
        assertEquals("/data", config.dir);
        assertEquals("snap.rdb", config.dbfilename);
        assertEquals("/data/snap.rdb", config.getDbFilePath());
    }

    @Test
    public void testOnlyNamedFileIsRead() throws IOException {
        Files.write(tempDir.resolve("minis.yaml"), "port: 7002\n".getBytes(StandardCharsets.UTF_8));
        Config config = Config.load(tempDir.resolve("minis.conf").toString());
        assertEquals(6379, config.port);
    }

    @Test
    public void testLegacyFormat() throws IOException {
        Path file = tempDir.resolve("minis.conf");
        Files.write(file, ("# legacy style\n" +
                "port 7003\n" +
                "dir /legacy\n" +
                "\n" +
                "dbfilename legacy.rdb\n").getBytes(StandardCharsets.UTF_8));

        Config config = Config.load(file.toString());
        assertEquals(7003, config.port);
        assertEquals("/legacy", config.dir);
        assertEquals("legacy.rdb", config.dbfilename);
    }

    @Test
    public void testArgsOverrideFile() {
        Config config = new Config().applyArgs(new String[]{"--port", "7010", "--dir=/args", "--dbfilename", "a.rdb"});
        assertEquals(7010, config.port);
        assertEquals("/args", config.dir);
        assertEquals("a.rdb", config.dbfilename);
    }

    @Test
    public void testBadArgs() {
        assertThrows(IllegalArgumentException.class, () -> new Config().applyArgs(new String[]{"--port", "abc"}));
        assertThrows(IllegalArgumentException.class, () -> new Config().applyArgs(new String[]{"--port", "70000"}));
        assertThrows(IllegalArgumentException.class, () -> new Config().applyArgs(new String[]{"--verbose", "1"}));
        assertThrows(IllegalArgumentException.class, () -> new Config().applyArgs(new String[]{"--dir"}));
        assertThrows(IllegalArgumentException.class, () -> new Config().applyArgs(new String[]{"positional"}));
    }

    @Test
    public void testRuntimeParameters() {
        Config config = new Config();
        assertTrue(config.setParameter("dir", "/x"));
        assertTrue(config.setParameter("DbFileName", "y.rdb"));
        assertFalse(config.setParameter("port", "1"));

        assertEquals("/x", config.getParameter("DIR"));
        assertEquals("y.rdb", config.getParameter("dbfilename"));
        assertNull(config.getParameter("port"));
    }
}
