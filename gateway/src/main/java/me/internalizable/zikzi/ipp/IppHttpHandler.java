package me.internalizable.zikzi.ipp;

import com.google.common.base.Splitter;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import me.internalizable.zikzi.auth.AuthRequest;
import me.internalizable.zikzi.net.TrustedProxyMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * Serves IPP over HTTP on every path.
 *
 * <p>The aggregated POST body is decoded with {@link IppCodec} and handed to the
 * {@link IppService}. A body that cannot be decoded is answered with
 * {@code client-error-bad-request} and request id 0, since the real one is unknown.</p>
 *
 * <p>Forwarding headers ({@code X-Forwarded-For}, then {@code X-Real-IP}) are only read
 * from peers the {@link TrustedProxyMatcher} accepts.</p>
 */
public class IppHttpHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger LOGGER = LoggerFactory.getLogger(IppHttpHandler.class);

    static final String CONTENT_TYPE = "application/ipp";

    private static final String X_FORWARDED_FOR = "X-Forwarded-For";
    private static final String X_REAL_IP = "X-Real-IP";

    private final IppService service;
    private final TrustedProxyMatcher proxyMatcher;

    public IppHttpHandler(@Nonnull IppService service, @Nonnull TrustedProxyMatcher proxyMatcher) {
        this.service = Objects.requireNonNull(service, "service");
        this.proxyMatcher = Objects.requireNonNull(proxyMatcher, "proxyMatcher");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        if (!HttpMethod.POST.equals(request.method())) {
            FullHttpResponse response = new DefaultFullHttpResponse(request.protocolVersion(),
                HttpResponseStatus.METHOD_NOT_ALLOWED, Unpooled.EMPTY_BUFFER);
            response.headers().set(HttpHeaderNames.ALLOW, HttpMethod.POST.name());
            send(ctx, request, response);
            return;
        }

        String clientIp = clientIp(ctx, request);
        ByteBuf body = request.content();
        if (body.readableBytes() < IppCodec.HEADER_LENGTH) {
            LOGGER.debug("IPP request from {} too short ({} bytes)", clientIp, body.readableBytes());
            sendIpp(ctx, request, IppMessage.response(IppStatus.CLIENT_ERROR_BAD_REQUEST, 0));
            return;
        }

        IppMessage message;
        try {
            message = IppCodec.decode(body.duplicate());
        } catch (IppFormatException e) {
            LOGGER.debug("Malformed IPP request from {}: {}", clientIp, e.getMessage());
            sendIpp(ctx, request, IppMessage.response(IppStatus.CLIENT_ERROR_BAD_REQUEST, 0));
            return;
        }

        AuthRequest auth = new AuthRequest(request.method().name(),
            request.headers().get(HttpHeaderNames.AUTHORIZATION));
        IppReply reply = service.handle(message, IppCodec.extractDocument(body), auth, clientIp);

        if (reply.isChallenge()) {
            FullHttpResponse response = new DefaultFullHttpResponse(request.protocolVersion(),
                HttpResponseStatus.UNAUTHORIZED, Unpooled.EMPTY_BUFFER);
            response.headers().add(HttpHeaderNames.WWW_AUTHENTICATE, reply.getChallenges());
            send(ctx, request, response);
            return;
        }
        sendIpp(ctx, request, reply.getResponse());
    }

    private String clientIp(ChannelHandlerContext ctx, FullHttpRequest request) {
        SocketAddress remote = ctx.channel().remoteAddress();
        String peerIp = remote instanceof InetSocketAddress && ((InetSocketAddress) remote).getAddress() != null
            ? ((InetSocketAddress) remote).getAddress().getHostAddress()
            : String.valueOf(remote);

        if (!proxyMatcher.isTrusted(peerIp)) {
            return peerIp;
        }

        String forwardedFor = request.headers().get(X_FORWARDED_FOR);
        if (forwardedFor != null) {
            String first = Splitter.on(',').trimResults().split(forwardedFor).iterator().next();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String realIp = request.headers().get(X_REAL_IP);
        if (realIp != null && !realIp.trim().isEmpty()) {
            return realIp.trim();
        }
        return peerIp;
    }

    private void sendIpp(ChannelHandlerContext ctx, FullHttpRequest request, IppMessage message) {
        ByteBuf content = ctx.alloc().buffer();
        IppCodec.encode(message, content);
        FullHttpResponse response = new DefaultFullHttpResponse(request.protocolVersion(),
            HttpResponseStatus.OK, content);
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, CONTENT_TYPE);
        send(ctx, request, response);
    }

    private void send(ChannelHandlerContext ctx, FullHttpRequest request, FullHttpResponse response) {
        HttpUtil.setContentLength(response, response.content().readableBytes());
        boolean keepAlive = HttpUtil.isKeepAlive(request);
        if (keepAlive) {
            if (request.protocolVersion().equals(HttpVersion.HTTP_1_0)) {
                response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            }
            ctx.writeAndFlush(response);
        } else {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.warn("Error on IPP connection from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }
}
