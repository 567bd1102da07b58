package minis;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class MinisServerIntegrationTest {

    private MinisServer server;
    private int port;

    @BeforeEach
    public void startServer() throws InterruptedException {
        Config config = new Config();
        config.port = 0;
        config.dir = "/srv";
        server = new MinisServer(config);
        port = server.start();
    }

    @AfterEach
    public void stopServer() {
        server.close();
    }

    private static String readExactly(InputStream in, int n) throws IOException {
        byte[] buf = in.readNBytes(n);
        return new String(buf, StandardCharsets.UTF_8);
    }

    @Test
    public void testRequestsOverSocket() throws IOException {
        try (Socket socket = new Socket("127.0.0.1", port)) {
            socket.setSoTimeout(5000);
            OutputStream out = socket.getOutputStream();
            InputStream in = socket.getInputStream();

            out.write("*1\r\n$4\r\nPING\r\n".getBytes(StandardCharsets.UTF_8));
            out.flush();
            assertEquals("+PONG\r\n", readExactly(in, 7));

            out.write("*5\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n$2\r\nPX\r\n$5\r\n60000\r\n".getBytes(StandardCharsets.UTF_8));
            out.flush();
            assertEquals("+OK\r\n", readExactly(in, 5));

            out.write("*2\r\n$3\r\nGET\r\n$1\r\nk\r\n".getBytes(StandardCharsets.UTF_8));
            out.flush();
            assertEquals("$1\r\nv\r\n", readExactly(in, 7));

            out.write("*3\r\n$6\r\nCONFIG\r\n$3\r\nGET\r\n$3\r\ndir\r\n".getBytes(StandardCharsets.UTF_8));
            out.flush();
            assertEquals("$4\r\n/srv\r\n", readExactly(in, 10));

            out.write("*1\r\n$3\r\nFOO\r\n*1\r\n$4\r\nPING\r\n".getBytes(StandardCharsets.UTF_8));
            out.flush();
            String expected = "-ERR unknown command: FOO\r\n+PONG\r\n";
            assertEquals(expected, readExactly(in, expected.length()));
        }
    }

    @Test
    public void testSeparateClientsShareStore() throws IOException {
        try (Socket a = new Socket("127.0.0.1", port); Socket b = new Socket("127.0.0.1", port)) {
            a.setSoTimeout(5000);
            b.setSoTimeout(5000);

            a.getOutputStream().write("*3\r\n$3\r\nSET\r\n$1\r\nx\r\n$2\r\n42\r\n".getBytes(StandardCharsets.UTF_8));
            assertEquals("+OK\r\n", readExactly(a.getInputStream(), 5));

            b.getOutputStream().write("*2\r\n$3\r\nGET\r\n$1\r\nx\r\n".getBytes(StandardCharsets.UTF_8));
            assertEquals("$2\r\n42\r\n", readExactly(b.getInputStream(), 8));
        }
        assertEquals(1, server.getContext().getDatabase().size());
    }

    @Test
    public void testGarbageClosesOnlyThatConnection() throws IOException {
        try (Socket bad = new Socket("127.0.0.1", port); Socket good = new Socket("127.0.0.1", port)) {
            bad.setSoTimeout(5000);
            good.setSoTimeout(5000);

            bad.getOutputStream().write("!!!\r\n".getBytes(StandardCharsets.UTF_8));
            assertEquals(-1, bad.getInputStream().read(), "server should close the connection");

            good.getOutputStream().write("*1\r\n$4\r\nPING\r\n".getBytes(StandardCharsets.UTF_8));
            assertEquals("+PONG\r\n", readExactly(good.getInputStream(), 7));
        }
    }
}
