package me.internalizable.zikzi.ipp;

import com.google.common.collect.ImmutableSet;
import io.netty.buffer.ByteBuf;
import me.internalizable.zikzi.api.auth.AuthResult;
import me.internalizable.zikzi.api.model.JobStatus;
import me.internalizable.zikzi.api.model.PrintJob;
import me.internalizable.zikzi.api.store.PrintJobRepository;
import me.internalizable.zikzi.api.store.StoreException;
import me.internalizable.zikzi.auth.AuthOutcome;
import me.internalizable.zikzi.auth.AuthRequest;
import me.internalizable.zikzi.auth.AuthResolver;
import me.internalizable.zikzi.config.IppAuthConfig;
import me.internalizable.zikzi.conversion.ConversionDispatcher;
import me.internalizable.zikzi.store.JobFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;

import static com.google.common.base.Strings.nullToEmpty;

/**
 * Executes decoded IPP operations.
 *
 * <h2>Operations</h2>
 * <ul>
 *   <li>Print-Job: stores the document as a new job and queues it for conversion</li>
 *   <li>Validate-Job and Cancel-Job: always succeed, nothing is changed</li>
 *   <li>Get-Printer-Attributes: static capabilities plus the current queue length</li>
 *   <li>Get-Jobs: the 100 most recent jobs, limited to the caller's own when known</li>
 *   <li>Get-Job-Attributes: one job, addressed by the last segment of its {@code job-uri}</li>
 * </ul>
 *
 * <p>Every operation except Get-Printer-Attributes and Get-Job-Attributes passes the
 * {@link AuthResolver} first. An unauthenticated caller is either challenged, refused or
 * served anonymously, depending on the configuration.</p>
 */
public class IppService {

    private static final Logger LOGGER = LoggerFactory.getLogger(IppService.class);

    static final int MAX_LISTED_JOBS = 100;
    static final String APP_NAME = "IPP Client";

    // Print-Job responses use a fixed job-id, clients follow job-uri
    private static final int PRINT_JOB_ID = 1;

    private static final int PRINTER_STATE_IDLE = 3;
    private static final int MULTIPLE_OPERATION_TIME_OUT = 120;

    private final String printerUri;
    private final IppAuthConfig authConfig;
    private final boolean allowAnonymous;
    private final AuthResolver authResolver;
    private final PrintJobRepository jobs;
    private final JobFiles jobFiles;
    private final ConversionDispatcher conversions;
    private final Clock clock;

    /**
     * @param allowAnonymous whether callers that are neither registered nor challenged may
     *                       use operations that need a user
     */
    public IppService(@Nonnull String printerUri,
                      @Nonnull IppAuthConfig authConfig,
                      boolean allowAnonymous,
                      @Nonnull AuthResolver authResolver,
                      @Nonnull PrintJobRepository jobs,
                      @Nonnull JobFiles jobFiles,
                      @Nonnull ConversionDispatcher conversions,
                      @Nonnull Clock clock) {
        this.printerUri = Objects.requireNonNull(printerUri, "printerUri");
        this.authConfig = Objects.requireNonNull(authConfig, "authConfig");
        this.allowAnonymous = allowAnonymous;
        this.authResolver = Objects.requireNonNull(authResolver, "authResolver");
        this.jobs = Objects.requireNonNull(jobs, "jobs");
        this.jobFiles = Objects.requireNonNull(jobFiles, "jobFiles");
        this.conversions = Objects.requireNonNull(conversions, "conversions");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Handles one request.
     *
     * @param request  the decoded request
     * @param document the bytes following the attributes, possibly empty
     * @param auth     HTTP method and {@code Authorization} header of the request
     * @param clientIp the client address, after proxy header resolution
     */
    @Nonnull
    public IppReply handle(@Nonnull IppMessage request, @Nonnull ByteBuf document,
                           @Nonnull AuthRequest auth, @Nonnull String clientIp) {
        int operation = request.getCode();
        int requestId = request.getRequestId();
        LOGGER.debug("IPP {} (request {}) from {}", IppOperation.name(operation), requestId, clientIp);

        String userId = null;
        if (!IppOperation.isAnonymous(operation)) {
            AuthOutcome outcome = authResolver.resolve(auth, clientIp);
            AuthResult result = outcome.getResult();
            if (result.isAuthenticated()) {
                userId = result.getUserId();
            } else if (outcome.isMustChallenge()) {
                LOGGER.debug("IPP {} from {} needs credentials, sending challenge",
                    IppOperation.name(operation), clientIp);
                return IppReply.challenge(authResolver.challenge());
            } else if (!allowAnonymous) {
                LOGGER.warn("IPP {} from unregistered client {} refused", IppOperation.name(operation), clientIp);
                return IppReply.respond(IppMessage.response(IppStatus.CLIENT_ERROR_NOT_AUTHORIZED, requestId));
            }
        }

        try {
            return IppReply.respond(execute(request, document, userId, clientIp));
        } catch (StoreException e) {
            LOGGER.error("IPP {} failed: store error", IppOperation.name(operation), e);
            return IppReply.respond(IppMessage.response(IppStatus.SERVER_ERROR_INTERNAL_ERROR, requestId));
        }
    }

    private IppMessage execute(IppMessage request, ByteBuf document, String userId, String clientIp) {
        int requestId = request.getRequestId();
        switch (request.getCode()) {
            case IppOperation.PRINT_JOB:
                return printJob(request, document, userId, clientIp);
            case IppOperation.VALIDATE_JOB:
            case IppOperation.CANCEL_JOB:
                return IppMessage.response(IppStatus.SUCCESSFUL_OK, requestId);
            case IppOperation.GET_PRINTER_ATTRIBUTES:
                return getPrinterAttributes(requestId);
            case IppOperation.GET_JOBS:
                return getJobs(requestId, userId);
            case IppOperation.GET_JOB_ATTRIBUTES:
                return getJobAttributes(request);
            default:
                LOGGER.debug("Unsupported IPP operation {}", IppOperation.name(request.getCode()));
                return IppMessage.response(IppStatus.SERVER_ERROR_OPERATION_NOT_SUPPORTED, requestId);
        }
    }

    // ==================== Print-Job ====================

    private IppMessage printJob(IppMessage request, ByteBuf document, String userId, String clientIp) {
        int requestId = request.getRequestId();
        if (!document.isReadable()) {
            LOGGER.debug("Print-Job from {} carries no document", clientIp);
            return IppMessage.response(IppStatus.CLIENT_ERROR_BAD_REQUEST, requestId);
        }

        PrintJob job = new PrintJob(userId, clientIp);
        request.getOperationString("job-name").ifPresent(job::setDocumentName);
        request.getOperationString("requesting-user-name").ifPresent(job::setHostname);
        String extension = request.getOperationString("document-format")
            .filter(format -> format.contains("pdf"))
            .map(format -> ".pdf")
            .orElse(".ps");

        jobs.create(job);

        Instant now = clock.instant();
        long size = document.readableBytes();
        Path file;
        try {
            file = jobFiles.originalFile(job.getId(), now, extension);
            try (OutputStream out = Files.newOutputStream(file, StandardOpenOption.CREATE_NEW,
                    StandardOpenOption.WRITE)) {
                document.getBytes(document.readerIndex(), out, (int) size);
            }
        } catch (IOException e) {
            LOGGER.error("Failed to write document of print job {}", job.getId(), e);
            job.markFailed("failed to store document: " + e.getMessage(), clock.instant());
            jobs.save(job);
            return IppMessage.response(IppStatus.SERVER_ERROR_INTERNAL_ERROR, requestId);
        }

        job.setAppName(APP_NAME);
        job.markProcessing(file.toString(), size);
        jobs.save(job);
        LOGGER.info("Received IPP print job {} from {}: '{}' ({} bytes)",
            job.getId(), clientIp, job.getDocumentName(), size);

        JobStatus state = JobStatus.PROCESSING;
        try {
            conversions.dispatch(job);
        } catch (RejectedExecutionException e) {
            LOGGER.error("Print job {} was stored but not queued for conversion", job.getId());
            state = JobStatus.FAILED;
        }

        IppMessage response = IppMessage.response(IppStatus.SUCCESSFUL_OK, requestId);
        response.addGroup(IppTag.JOB)
            .add("job-id", IppValue.integer(PRINT_JOB_ID))
            .add("job-uri", IppValue.uri(jobUri(job)))
            .add("job-state", IppValue.enumValue(jobState(state)))
            .add("job-state-reasons", IppValue.keyword(jobStateReason(state)));
        return response;
    }

    // ==================== Get-Printer-Attributes ====================

    private IppMessage getPrinterAttributes(int requestId) {
        long queued = jobs.countByStatus(ImmutableSet.of(JobStatus.RECEIVED, JobStatus.PROCESSING));

        IppMessage response = IppMessage.response(IppStatus.SUCCESSFUL_OK, requestId);
        IppAttributeGroup printer = response.addGroup(IppTag.PRINTER)
            .add("printer-uri-supported", IppValue.uri(printerUri))
            .add("uri-security-supported", IppValue.keyword("none"))
            .add(authenticationSupported())
            .add("requesting-user-name-supported", IppValue.bool(true))
            .add("printer-name", IppValue.name("Zikzi Printer"))
            .add("printer-info", IppValue.text("Zikzi Multi-User Printing Server"))
            .add("printer-make-and-model", IppValue.text("Zikzi Virtual Printer"))
            .add("printer-state", IppValue.enumValue(PRINTER_STATE_IDLE))
            .add("printer-state-reasons", IppValue.keyword("none"))
            .add("printer-is-accepting-jobs", IppValue.bool(true))
            .add("operations-supported",
                IppValue.enumValue(IppOperation.PRINT_JOB),
                IppValue.enumValue(IppOperation.VALIDATE_JOB),
                IppValue.enumValue(IppOperation.GET_PRINTER_ATTRIBUTES),
                IppValue.enumValue(IppOperation.GET_JOBS),
                IppValue.enumValue(IppOperation.GET_JOB_ATTRIBUTES),
                IppValue.enumValue(IppOperation.CANCEL_JOB))
            .add("document-format-supported",
                IppValue.mimeMediaType("application/postscript"),
                IppValue.mimeMediaType("application/pdf"),
                IppValue.mimeMediaType("application/octet-stream"))
            .add("document-format-default", IppValue.mimeMediaType("application/postscript"))
            .add("color-supported", IppValue.bool(true))
            .add("print-color-mode-supported",
                IppValue.keyword("auto"), IppValue.keyword("color"), IppValue.keyword("monochrome"))
            .add("print-color-mode-default", IppValue.keyword("auto"))
            .add("charset-configured", IppValue.charset("utf-8"))
            .add("charset-supported", IppValue.charset("utf-8"))
            .add("natural-language-configured", IppValue.naturalLanguage("en"))
            .add("generated-natural-language-supported", IppValue.naturalLanguage("en"))
            .add("ipp-versions-supported", IppValue.keyword("1.0"), IppValue.keyword("1.1"), IppValue.keyword("2.0"))
            .add("pdl-override-supported", IppValue.keyword("attempted"))
            .add("multiple-document-jobs-supported", IppValue.bool(false))
            .add("multiple-operation-time-out", IppValue.integer(MULTIPLE_OPERATION_TIME_OUT));
        printer.add("queued-job-count", IppValue.integer((int) Math.min(queued, Integer.MAX_VALUE)));
        return response;
    }

    private IppAttribute authenticationSupported() {
        IppAttribute attribute = new IppAttribute("uri-authentication-supported");
        if (authConfig.isAllowIp()) {
            attribute.addValue(IppValue.keyword("requesting-user-name"));
        }
        if (authConfig.isAllowLogin()) {
            attribute.addValue(IppValue.keyword("basic"));
            attribute.addValue(IppValue.keyword("digest"));
        }
        if (attribute.getFirst() == null) {
            attribute.addValue(IppValue.keyword("none"));
        }
        return attribute;
    }

    // ==================== Jobs ====================

    private IppMessage getJobs(int requestId, String userId) {
        List<PrintJob> recent = jobs.findRecent(userId == null || userId.isEmpty() ? null : userId, MAX_LISTED_JOBS);

        IppMessage response = IppMessage.response(IppStatus.SUCCESSFUL_OK, requestId);
        int position = 1;
        for (PrintJob job : recent) {
            response.addGroup(IppTag.JOB)
                .add("job-id", IppValue.integer(position++))
                .add("job-uri", IppValue.uri(jobUri(job)))
                .add("job-state", IppValue.enumValue(jobState(job.getStatus())))
                .add("job-name", IppValue.name(nullToEmpty(job.getDocumentName())));
        }
        return response;
    }

    private IppMessage getJobAttributes(IppMessage request) {
        int requestId = request.getRequestId();
        Optional<String> jobUri = request.getOperationString("job-uri");
        if (jobUri.isEmpty()) {
            return IppMessage.response(IppStatus.CLIENT_ERROR_BAD_REQUEST, requestId);
        }

        String uri = jobUri.get();
        String jobId = uri.substring(uri.lastIndexOf('/') + 1);
        if (jobId.isEmpty()) {
            return IppMessage.response(IppStatus.CLIENT_ERROR_BAD_REQUEST, requestId);
        }

        Optional<PrintJob> found = jobs.findById(jobId);
        if (found.isEmpty()) {
            return IppMessage.response(IppStatus.CLIENT_ERROR_NOT_FOUND, requestId);
        }

        PrintJob job = found.get();
        IppMessage response = IppMessage.response(IppStatus.SUCCESSFUL_OK, requestId);
        IppAttributeGroup group = response.addGroup(IppTag.JOB)
            .add("job-id", IppValue.integer(PRINT_JOB_ID))
            .add("job-uri", IppValue.uri(jobUri(job)))
            .add("job-state", IppValue.enumValue(jobState(job.getStatus())))
            .add("job-state-reasons", IppValue.keyword(jobStateReason(job.getStatus())))
            .add("job-name", IppValue.name(nullToEmpty(job.getDocumentName())))
            .add("job-originating-user-name", IppValue.name(nullToEmpty(job.getHostname())));
        if (job.getPageCount() > 0) {
            group.add("job-media-sheets-completed", IppValue.integer(job.getPageCount()));
        }
        return response;
    }

    private String jobUri(PrintJob job) {
        return printerUri + "/jobs/" + job.getId();
    }

    static int jobState(JobStatus status) {
        switch (status) {
            case RECEIVED:
                return 3;
            case PROCESSING:
                return 5;
            case COMPLETED:
                return 9;
            case FAILED:
                return 8;
            default:
                throw new IllegalArgumentException("Unknown job status " + status);
        }
    }

    static String jobStateReason(JobStatus status) {
        switch (status) {
            case RECEIVED:
                return "job-incoming";
            case PROCESSING:
                return "job-printing";
            case COMPLETED:
                return "job-completed-successfully";
            case FAILED:
                return "job-aborted-by-system";
            default:
                throw new IllegalArgumentException("Unknown job status " + status);
        }
    }
}
