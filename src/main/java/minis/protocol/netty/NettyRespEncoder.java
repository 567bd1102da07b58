package minis.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import minis.protocol.Resp;
import minis.protocol.RespValue;

/**
 * Encodes reply values into RESP bytes.
 */
public class NettyRespEncoder extends MessageToByteEncoder<RespValue> {

    @Override
    protected void encode(ChannelHandlerContext ctx, RespValue msg, ByteBuf out) throws Exception {
        out.writeBytes(Resp.encode(msg));
    }
}
