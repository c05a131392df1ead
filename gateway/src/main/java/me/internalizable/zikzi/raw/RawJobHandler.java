package me.internalizable.zikzi.raw;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import me.internalizable.zikzi.api.model.IpRegistration;
import me.internalizable.zikzi.api.model.PrintJob;
import me.internalizable.zikzi.api.store.StoreException;
import me.internalizable.zikzi.conversion.ConversionDispatcher;
import me.internalizable.zikzi.pipeline.proxy.ProxyProtocolEvent;
import me.internalizable.zikzi.pipeline.proxy.ProxyProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;

/**
 * Receives one raw PostScript document per connection.
 *
 * <p>The job is created as soon as the client is known: on {@code channelActive}, or on
 * the {@link ProxyProtocolEvent} when a PROXY header may precede the payload. Every chunk
 * is appended to the job's file and fed to a {@link DscMetadataParser}. When the client
 * closes the connection the job is finalized and handed to the {@link ConversionDispatcher}.</p>
 *
 * <p>Runs on a dedicated executor group, never on the I/O loop, since it does blocking
 * file and store work.</p>
 */
public class RawJobHandler extends SimpleChannelInboundHandler<ByteBuf> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RawJobHandler.class);

    private static final int WRITE_BUFFER_SIZE = 64 * 1024;

    private final RawIntake intake;
    private final boolean awaitProxyHeader;
    private final DscMetadataParser parser = new DscMetadataParser();

    private boolean started;
    private boolean failed;
    private PrintJob job;
    private Path file;
    private OutputStream out;
    private long bytesWritten;

    /**
     * @param intake           shared collaborators of the raw listener
     * @param awaitProxyHeader whether a {@link ProxyProtocolHandler} precedes this handler
     */
    public RawJobHandler(@Nonnull RawIntake intake, boolean awaitProxyHeader) {
        this.intake = Objects.requireNonNull(intake, "intake");
        this.awaitProxyHeader = awaitProxyHeader;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        if (!awaitProxyHeader) {
            start(ctx);
        }
        super.channelActive(ctx);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof ProxyProtocolEvent) {
            start(ctx);
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    private void start(ChannelHandlerContext ctx) {
        if (started) {
            return;
        }
        started = true;

        String clientIp = clientIp(ctx);
        Instant now = intake.getClock().instant();

        Optional<IpRegistration> registration;
        try {
            registration = intake.getIpRegistrations().findUsable(clientIp, now);
        } catch (StoreException e) {
            LOGGER.error("Failed to look up IP registration for {}", clientIp, e);
            abort(ctx);
            return;
        }

        String userId = null;
        if (registration.isPresent()) {
            userId = registration.get().getUserId();
        } else if (!intake.isAllowUnregisteredIps()) {
            LOGGER.warn("Rejected print job from unregistered IP: {}", clientIp);
            abort(ctx);
            return;
        }

        PrintJob created = new PrintJob(userId, clientIp);
        try {
            intake.getJobs().create(created);
        } catch (StoreException e) {
            LOGGER.error("Failed to create print job for {}", clientIp, e);
            abort(ctx);
            return;
        }
        job = created;

        try {
            file = intake.getJobFiles().originalFile(job.getId(), now, ".ps");
            out = new BufferedOutputStream(
                Files.newOutputStream(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE),
                WRITE_BUFFER_SIZE);
        } catch (IOException e) {
            LOGGER.error("Failed to create file for print job {}", job.getId(), e);
            abort(ctx, "failed to store document: " + e.getMessage());
            return;
        }

        LOGGER.debug("Print job {} started from {} (user {})", job.getId(), clientIp,
            userId != null ? userId : "orphaned");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) {
        if (out == null || failed) {
            return;
        }
        int length = msg.readableBytes();
        parser.feed(msg);
        try {
            msg.readBytes(out, length);
            bytesWritten += length;
        } catch (IOException e) {
            LOGGER.error("Failed to write print job {} to {}", job.getId(), file, e);
            abort(ctx, "failed to store document: " + e.getMessage());
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        try {
            if (job != null && !failed) {
                finish();
            }
        } finally {
            closeFile();
            super.channelInactive(ctx);
        }
    }

    private void finish() {
        try {
            out.close();
        } catch (IOException e) {
            LOGGER.error("Failed to flush print job {} to {}", job.getId(), file, e);
            failJob("failed to store document: " + e.getMessage());
            return;
        } finally {
            out = null;
        }

        PostScriptMetadata metadata = parser.finish();
        job.setDocumentName(metadata.getTitle());
        job.setHostname(metadata.getFor());
        job.setAppName(metadata.getCreator());
        job.markProcessing(file.toString(), bytesWritten);

        try {
            intake.getJobs().save(job);
        } catch (StoreException e) {
            LOGGER.error("Failed to save print job {}", job.getId(), e);
            failJob("failed to save job: " + e.getMessage());
            return;
        }

        LOGGER.info("Received print job {} from {}: '{}' ({} bytes)",
            job.getId(), job.getSourceIp(), job.getDocumentName(), bytesWritten);

        try {
            intake.getConversions().dispatch(job);
        } catch (RejectedExecutionException e) {
            LOGGER.error("Print job {} was stored but not queued for conversion", job.getId());
        }
    }

    private void abort(ChannelHandlerContext ctx) {
        failed = true;
        closeFile();
        ctx.close();
    }

    private void abort(ChannelHandlerContext ctx, String reason) {
        failed = true;
        closeFile();
        failJob(reason);
        ctx.close();
    }

    // A created job never stays RECEIVED or PROCESSING without a conversion behind it
    private void failJob(String reason) {
        if (job.getStatus().isTerminal()) {
            return;
        }
        job.markFailed(reason, intake.getClock().instant());
        try {
            intake.getJobs().save(job);
        } catch (StoreException e) {
            LOGGER.error("Failed to record failure of print job {}", job.getId(), e);
        }
    }

    private void closeFile() {
        if (out == null) {
            return;
        }
        try {
            out.close();
        } catch (IOException e) {
            LOGGER.warn("Failed to close {}", file, e);
        } finally {
            out = null;
        }
    }

    private static String clientIp(ChannelHandlerContext ctx) {
        InetSocketAddress announced = ctx.channel().attr(ProxyProtocolHandler.REAL_CLIENT_ADDRESS).get();
        if (announced != null) {
            return announced.getAddress().getHostAddress();
        }
        SocketAddress remote = ctx.channel().remoteAddress();
        if (remote instanceof InetSocketAddress inet && inet.getAddress() != null) {
            return inet.getAddress().getHostAddress();
        }
        return String.valueOf(remote);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.warn("Error on raw print connection from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }
}
