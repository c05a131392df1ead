package me.internalizable.zikzi.pipeline.proxy;

import com.google.common.net.InetAddresses;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.util.AttributeKey;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Decodes the HAProxy PROXY protocol (versions 1 and 2) in front of a raw print connection.
 *
 * <p>This handler MUST be the first handler of the child channel pipeline. It consumes the
 * header, stores the announced client address as the {@link #REAL_CLIENT_ADDRESS} channel
 * attribute, fires a {@link ProxyProtocolEvent} and then removes itself, handing any
 * buffered payload bytes to the next handler.</p>
 *
 * <h2>Policies</h2>
 * <ul>
 *   <li>{@link ProxyProtocolPolicy#USE}: a missing header is not an error, the bytes are payload</li>
 *   <li>{@link ProxyProtocolPolicy#REQUIRE}: a missing or invalid header closes the connection</li>
 * </ul>
 * <p>{@link ProxyProtocolPolicy#IGNORE} connections never get this handler.</p>
 *
 * <h2>Header timeout</h2>
 * <p>The connection is closed when no complete header (or enough bytes to rule one out)
 * arrives within the configured timeout.</p>
 *
 * @see <a href="https://www.haproxy.org/download/2.0/doc/proxy-protocol.txt">PROXY Protocol Specification</a>
 */
public final class ProxyProtocolHandler extends ByteToMessageDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProxyProtocolHandler.class);

    /**
     * Channel attribute key for the client address announced in the PROXY header.
     */
    public static final AttributeKey<InetSocketAddress> REAL_CLIENT_ADDRESS =
            AttributeKey.valueOf("PROXY_REAL_CLIENT_ADDRESS");

    // "PROXY "
    private static final byte[] V1_SIGNATURE = "PROXY ".getBytes(StandardCharsets.US_ASCII);

    // \r\n\r\n\0\r\nQUIT\n
    private static final byte[] V2_SIGNATURE = {
            0x0D, 0x0A, 0x0D, 0x0A, 0x00, 0x0D, 0x0A, 0x51, 0x55, 0x49, 0x54, 0x0A
    };

    // Including CRLF
    private static final int V1_MAX_LINE_LENGTH = 108;

    private static final int V2_HEADER_MIN_SIZE = 16;

    private final ProxyProtocolPolicy policy;
    private final long headerTimeoutMillis;
    private final boolean debugMode;

    private ScheduledFuture<?> timeoutFuture;
    private boolean completed;

    /**
     * @param policy              {@link ProxyProtocolPolicy#USE} or {@link ProxyProtocolPolicy#REQUIRE}
     * @param headerTimeoutMillis maximum time to wait for the header, 0 disables the timeout
     * @param debugMode           whether to log the raw headers
     */
    public ProxyProtocolHandler(@Nonnull ProxyProtocolPolicy policy, long headerTimeoutMillis, boolean debugMode) {
        this.policy = Objects.requireNonNull(policy, "policy");
        if (policy == ProxyProtocolPolicy.IGNORE) {
            throw new IllegalArgumentException("IGNORE connections do not decode PROXY headers");
        }
        this.headerTimeoutMillis = headerTimeoutMillis;
        this.debugMode = debugMode;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        if (headerTimeoutMillis > 0) {
            timeoutFuture = ctx.executor().schedule(() -> {
                if (!completed) {
                    LOGGER.warn("PROXY header not received from {} within {} ms, closing",
                            ctx.channel().remoteAddress(), headerTimeoutMillis);
                    ctx.close();
                }
            }, headerTimeoutMillis, TimeUnit.MILLISECONDS);
        }
    }

    @Override
    protected void handlerRemoved0(ChannelHandlerContext ctx) {
        cancelTimeout();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        cancelTimeout();
        super.channelInactive(ctx);
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (completed) {
            return;
        }
        int readerIndex = in.readerIndex();

        if (startsWith(in, readerIndex, V2_SIGNATURE)) {
            if (in.readableBytes() >= V2_SIGNATURE.length) {
                decodeV2(ctx, in);
            }
            return;
        }
        if (startsWith(in, readerIndex, V1_SIGNATURE)) {
            if (in.readableBytes() >= V1_SIGNATURE.length) {
                decodeV1(ctx, in);
            }
            return;
        }

        // Already ruled out by the first bytes
        noHeader(ctx);
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (completed) {
            return;
        }
        // The peer closed before the header could be classified
        if (policy == ProxyProtocolPolicy.REQUIRE) {
            LOGGER.warn("Connection from {} closed before a PROXY header arrived", ctx.channel().remoteAddress());
            in.skipBytes(in.readableBytes());
            return;
        }
        completed = true;
        cancelTimeout();
        ctx.fireUserEventTriggered(new ProxyProtocolEvent(null));
        if (in.isReadable()) {
            out.add(in.readRetainedSlice(in.readableBytes()));
        }
    }

    private void noHeader(ChannelHandlerContext ctx) {
        if (policy == ProxyProtocolPolicy.REQUIRE) {
            LOGGER.warn("Missing PROXY protocol header from {} (required), closing", ctx.channel().remoteAddress());
            completed = true;
            ctx.close();
            return;
        }
        LOGGER.debug("No PROXY protocol header from {}, using peer address", ctx.channel().remoteAddress());
        completeAndRemove(ctx, null);
    }

    private static boolean startsWith(ByteBuf buf, int readerIndex, byte[] signature) {
        int length = Math.min(buf.readableBytes(), signature.length);
        if (length == 0) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (buf.getByte(readerIndex + i) != signature[i]) {
                return false;
            }
        }
        return true;
    }

    // ==================== Version 1 Decoding ====================

    private void decodeV1(ChannelHandlerContext ctx, ByteBuf in) {
        int lineEnd = findCRLF(in, in.readerIndex(), Math.min(in.readableBytes(), V1_MAX_LINE_LENGTH));
        if (lineEnd < 0) {
            if (in.readableBytes() >= V1_MAX_LINE_LENGTH) {
                LOGGER.warn("PROXY v1 header from {} too long (no CRLF within {} bytes)",
                        ctx.channel().remoteAddress(), V1_MAX_LINE_LENGTH);
                rejectHeader(ctx, in);
            }
            return;
        }

        int lineLength = lineEnd - in.readerIndex();
        String line = in.toString(in.readerIndex(), lineLength, StandardCharsets.US_ASCII);
        in.skipBytes(lineLength + 2);

        if (debugMode) {
            LOGGER.debug("PROXY v1 header: {}", line);
        }
        parseV1Header(ctx, in, line);
    }

    private static int findCRLF(ByteBuf buf, int start, int maxLength) {
        int end = Math.min(start + maxLength, buf.writerIndex());
        for (int i = start; i < end - 1; i++) {
            if (buf.getByte(i) == '\r' && buf.getByte(i + 1) == '\n') {
                return i;
            }
        }
        return -1;
    }

    private void parseV1Header(ChannelHandlerContext ctx, ByteBuf in, String line) {
        // PROXY <TCP4|TCP6|UNKNOWN> <src_addr> <dst_addr> <src_port> <dst_port>
        String[] parts = line.split(" ");
        if (parts.length < 2) {
            LOGGER.warn("Invalid PROXY v1 header: {}", line);
            rejectHeader(ctx, in);
            return;
        }

        String protocol = parts[1];
        if ("UNKNOWN".equals(protocol)) {
            completeAndRemove(ctx, null);
            return;
        }
        if (!"TCP4".equals(protocol) && !"TCP6".equals(protocol)) {
            LOGGER.warn("Unsupported PROXY v1 protocol: {}", protocol);
            rejectHeader(ctx, in);
            return;
        }
        if (parts.length < 6) {
            LOGGER.warn("Invalid PROXY v1 header (missing fields): {}", line);
            rejectHeader(ctx, in);
            return;
        }

        try {
            InetAddress address = parseLiteral(parts[2]);
            int port = Integer.parseInt(parts[4]);
            completeAndRemove(ctx, new InetSocketAddress(address, port));
        } catch (IllegalArgumentException | UnknownHostException e) {
            LOGGER.warn("Failed to parse PROXY v1 addresses: {}", line);
            rejectHeader(ctx, in);
        }
    }

    private static InetAddress parseLiteral(String literal) throws UnknownHostException {
        if (!InetAddresses.isInetAddress(literal)) {
            throw new UnknownHostException("not an IP literal: " + literal);
        }
        return InetAddresses.forString(literal);
    }

    // ==================== Version 2 Decoding ====================

    private void decodeV2(ChannelHandlerContext ctx, ByteBuf in) {
        if (in.readableBytes() < V2_HEADER_MIN_SIZE) {
            return;
        }

        int readerIndex = in.readerIndex();
        byte verCmd = in.getByte(readerIndex + 12);
        int version = (verCmd & 0xF0) >> 4;
        int command = verCmd & 0x0F;
        byte famProto = in.getByte(readerIndex + 13);
        int addressFamily = (famProto & 0xF0) >> 4;
        int addressLen = in.getUnsignedShort(readerIndex + 14);

        if (version != 2) {
            LOGGER.warn("Unsupported PROXY protocol version: {}", version);
            rejectHeader(ctx, in);
            return;
        }

        if (in.readableBytes() < V2_HEADER_MIN_SIZE + addressLen) {
            return;
        }

        if (debugMode) {
            LOGGER.debug("PROXY v2 header: command={}, family={}, addrLen={}", command, addressFamily, addressLen);
        }

        in.skipBytes(V2_HEADER_MIN_SIZE);
        ByteBuf addresses = in.readSlice(addressLen);

        switch (command) {
            case 0x00: // LOCAL
                completeAndRemove(ctx, null);
                return;

            case 0x01: // PROXY
                parseV2Source(ctx, in, addresses, addressFamily);
                return;

            default:
                LOGGER.warn("Unsupported PROXY v2 command: {}", command);
                rejectHeader(ctx, in);
        }
    }

    private void parseV2Source(ChannelHandlerContext ctx, ByteBuf in, ByteBuf addresses, int addressFamily) {
        InetSocketAddress source = null;
        try {
            switch (addressFamily) {
                case 0x01: // AF_INET
                    if (addresses.readableBytes() < 12) {
                        LOGGER.warn("PROXY v2 IPv4 address block too short: {}", addresses.readableBytes());
                        rejectHeader(ctx, in);
                        return;
                    }
                    source = readSource(addresses, 4);
                    break;

                case 0x02: // AF_INET6
                    if (addresses.readableBytes() < 36) {
                        LOGGER.warn("PROXY v2 IPv6 address block too short: {}", addresses.readableBytes());
                        rejectHeader(ctx, in);
                        return;
                    }
                    source = readSource(addresses, 16);
                    break;

                default:
                    // AF_UNSPEC, AF_UNIX: keep the peer address
                    LOGGER.debug("PROXY v2 address family {} carries no IP, using peer address", addressFamily);
            }
        } catch (UnknownHostException e) {
            LOGGER.warn("Failed to parse PROXY v2 source address", e);
            rejectHeader(ctx, in);
            return;
        }
        // Remaining bytes of the block are TLVs and are ignored
        completeAndRemove(ctx, source);
    }

    private static InetSocketAddress readSource(ByteBuf addresses, int addressSize) throws UnknownHostException {
        byte[] src = new byte[addressSize];
        addresses.readBytes(src);
        addresses.skipBytes(addressSize);
        int srcPort = addresses.readUnsignedShort();
        return new InetSocketAddress(InetAddress.getByAddress(src), srcPort);
    }

    // ==================== Completion ====================

    private void rejectHeader(ChannelHandlerContext ctx, ByteBuf in) {
        completed = true;
        cancelTimeout();
        in.skipBytes(in.readableBytes());
        ctx.close();
    }

    private void completeAndRemove(ChannelHandlerContext ctx, @Nullable InetSocketAddress sourceAddress) {
        completed = true;
        cancelTimeout();

        if (sourceAddress != null) {
            ctx.channel().attr(REAL_CLIENT_ADDRESS).set(sourceAddress);
            LOGGER.debug("PROXY protocol: client {} via {}", sourceAddress, ctx.channel().remoteAddress());
        }

        // Downstream handlers learn the address before the first payload byte
        ctx.fireUserEventTriggered(new ProxyProtocolEvent(sourceAddress));
        ctx.pipeline().remove(this);
    }

    private void cancelTimeout() {
        if (timeoutFuture != null) {
            timeoutFuture.cancel(false);
            timeoutFuture = null;
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.error("Error processing PROXY protocol from {}", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }
}
