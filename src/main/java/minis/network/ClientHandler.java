package minis.network;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import minis.MinisServerContext;
import minis.commands.CommandDispatcher;
import minis.protocol.RespValue;
import minis.utils.Log;

import java.io.IOException;

/**
 * One instance per connection. Each decoded frame is dispatched and its reply
 * written back; frames on a connection are handled in arrival order.
 */
public class ClientHandler extends ChannelInboundHandlerAdapter {
    private final MinisServerContext context;
    private final CommandDispatcher dispatcher;

    public ClientHandler(MinisServerContext context, CommandDispatcher dispatcher) {
        this.context = context;
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        context.connectionOpened();
        Log.debug("Client connected: " + ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        context.connectionClosed();
        Log.debug("Client disconnected: " + ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (msg instanceof RespValue) {
            RespValue reply = dispatcher.dispatch((RespValue) msg);
            ctx.writeAndFlush(reply);
        } else {
            super.channelRead(ctx, msg);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof IOException) {
            // Resets and broken pipes are the peer going away
            Log.debug("Connection " + ctx.channel().remoteAddress() + " closed: " + cause.getMessage());
        } else {
            Log.error("Unexpected error on " + ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }
}
