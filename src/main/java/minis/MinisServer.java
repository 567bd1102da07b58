package minis;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import minis.commands.CommandDispatcher;
import minis.db.MinisDatabase;
import minis.network.ClientHandler;
import minis.protocol.netty.NettyRespDecoder;
import minis.protocol.netty.NettyRespEncoder;
import minis.utils.Log;

import java.net.InetSocketAddress;

/**
 * Netty server wiring: one store and one dispatcher shared by every connection.
 */
public class MinisServer implements AutoCloseable {
    private final Config config;
    private final MinisServerContext context;
    private final CommandDispatcher dispatcher;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;
    private Thread monitor;
    private volatile boolean isRunning = false;

    public MinisServer(Config config) {
        this(config, new MinisDatabase());
    }

    public MinisServer(Config config, MinisDatabase db) {
        this.config = config;
        this.context = new MinisServerContext(db, config);
        this.dispatcher = new CommandDispatcher(context);
    }

    public MinisServerContext getContext() {
        return context;
    }

    /**
     * Binds the configured port (0 picks a free one) and starts accepting connections.
     *
     * @return the bound port
     */
    public int start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
         .channel(NioServerSocketChannel.class)
         .childHandler(new ChannelInitializer<SocketChannel>() {
             @Override
             public void initChannel(SocketChannel ch) throws Exception {
                 ch.pipeline().addLast(new NettyRespDecoder());
                 ch.pipeline().addLast(new NettyRespEncoder());
                 ch.pipeline().addLast(new ClientHandler(context, dispatcher));
             }
         });

        try {
            serverChannel = b.bind(config.port).sync().channel();
        } catch (Exception e) {
            // sync() rethrows bind failures as-is, including checked ones
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            throw e;
        }
        isRunning = true;
        startMonitor();

        int port = getPort();
        Log.info("Ready on port " + port);
        return port;
    }

    public int getPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    /** Blocks until the server channel is closed. */
    public void awaitTermination() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    private void startMonitor() {
        monitor = new Thread(() -> {
            long lastCount = 0;
            while (isRunning) {
                try {
                    Thread.sleep(5000);
                    long currentCount = context.getTotalCommandsProcessed();
                    long ops = (currentCount - lastCount) / 5;
                    lastCount = currentCount;

                    if (ops > 0 || context.getActiveConnections() > 0) {
                        Log.info(String.format("[STATS] Clients: %d | Keys: %d | OPS: %d cmd/s",
                            context.getActiveConnections(), context.getDatabase().size(), ops));
                    }
                } catch (InterruptedException e) {
                    break;
                }
            }
        }, "minis-monitor");
        monitor.setDaemon(true);
        monitor.start();
    }

    @Override
    public void close() {
        if (!isRunning) return;
        isRunning = false;
        Log.info("Shutting down...");
        monitor.interrupt();
        if (serverChannel != null) serverChannel.close().syncUninterruptibly();
        bossGroup.shutdownGracefully().syncUninterruptibly();
        workerGroup.shutdownGracefully().syncUninterruptibly();
    }
}
