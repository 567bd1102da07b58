package minis.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufInputStream;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import minis.protocol.Resp;
import minis.protocol.RespException;
import minis.protocol.RespValue;
import minis.utils.Log;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Netty decoder for RESP frames. Frame headers are scanned as bytes arrive, resuming
 * where the previous read stopped and jumping over bulk payloads, so a large frame
 * split over many reads is walked once. When a whole frame is buffered (or the bytes
 * are malformed) it runs {@link Resp#decode(InputStream)} over the buffer. Protocol
 * errors close the channel.
 */
public class NettyRespDecoder extends ByteToMessageDecoder {

    // Offset from the reader index where the next unscanned element starts
    private int scanned;
    // Elements the current frame still needs; 0 between frames
    private long pending;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (!frameReady(in)) {
            return; // Wait for more data
        }
        reset();

        int start = in.readerIndex();
        RespValue value;
        try (InputStream stream = new ByteBufInputStream(in)) {
            value = Resp.decode(stream);
        } catch (RespException e) {
            if (e.isEndOfInput()) {
                in.readerIndex(start);
                return;
            }
            Log.warn("Protocol error from " + ctx.channel().remoteAddress() + ": " + e.getMessage());
            in.skipBytes(in.readableBytes());
            ctx.close();
            return;
        }
        out.add(value);
    }

    /**
     * Advances the scan of the current frame over the buffered bytes.
     *
     * @return true once the frame is complete, or as soon as the bytes cannot be a
     *         valid frame so that the codec reports the error; false if more bytes are needed
     */
    private boolean frameReady(ByteBuf in) {
        if (pending == 0) {
            pending = 1;
            scanned = 0;
        }
        int base = in.readerIndex();
        int limit = in.writerIndex();

        while (pending > 0) {
            int pos = base + scanned;
            if (pos >= limit) return false;

            int type = in.getByte(pos);
            if (!isKnownType(type)) return true;

            int eol = in.indexOf(pos + 1, limit, (byte) '\n');
            if (eol < 0) {
                return limit - pos - 1 > Resp.MAX_LINE_LENGTH;
            }
            if (eol - pos - 1 > Resp.MAX_LINE_LENGTH || in.getByte(eol - 1) != '\r') {
                return true;
            }

            int next = eol + 1;
            if (type == Resp.BULK_STRING) {
                long len = headerValue(in, pos, eol);
                if (len < -1 || len > Integer.MAX_VALUE - 2) return true;
                if (len >= 0) {
                    long end = (long) next + len + 2;
                    if (end > limit) return false;
                    next = (int) end;
                }
            } else if (type == Resp.ARRAY) {
                long count = headerValue(in, pos, eol);
                if (count < -1 || count > Integer.MAX_VALUE) return true;
                if (count > 0) pending += count;
            }
            scanned = next - base;
            pending--;
        }
        return true;
    }

    private static boolean isKnownType(int type) {
        return type == Resp.SIMPLE_STRING || type == Resp.ERROR || type == Resp.INTEGER
                || type == Resp.BULK_STRING || type == Resp.ARRAY;
    }

    /** Length or count from a header line, or {@code Long.MIN_VALUE} if it is not a number. */
    private static long headerValue(ByteBuf in, int pos, int eol) {
        String line = in.toString(pos + 1, eol - pos - 2, StandardCharsets.UTF_8);
        try {
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            return Long.MIN_VALUE;
        }
    }

    private void reset() {
        scanned = 0;
        pending = 0;
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        reset();
        if (in.isReadable()) {
            Log.warn("Connection " + ctx.channel().remoteAddress() + " closed mid-frame, dropping "
                    + in.readableBytes() + " bytes");
            in.skipBytes(in.readableBytes());
        }
    }
}
