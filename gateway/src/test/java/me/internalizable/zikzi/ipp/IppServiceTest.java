package me.internalizable.zikzi.ipp;

import com.google.common.io.BaseEncoding;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import me.internalizable.zikzi.MutableClock;
import me.internalizable.zikzi.api.model.IpRegistration;
import me.internalizable.zikzi.api.model.JobStatus;
import me.internalizable.zikzi.api.model.PrintJob;
import me.internalizable.zikzi.api.model.User;
import me.internalizable.zikzi.api.store.PrintJobRepository;
import me.internalizable.zikzi.api.store.StoreException;
import me.internalizable.zikzi.auth.AuthRequest;
import me.internalizable.zikzi.auth.AuthResolver;
import me.internalizable.zikzi.auth.NonceCache;
import me.internalizable.zikzi.config.IppAuthConfig;
import me.internalizable.zikzi.conversion.ConversionDispatcher;
import me.internalizable.zikzi.store.InMemoryPrintStore;
import me.internalizable.zikzi.store.JobFiles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IppServiceTest {

    private static final String PRINTER_URI = "ipp://printer.local:631/ipp/print";
    private static final String DOCUMENT = "%!PS-Adobe-3.0\nshowpage\n";
    private static final String REGISTERED_IP = "192.168.1.20";

    @TempDir
    Path jobsDir;

    private MutableClock clock;
    private InMemoryPrintStore store;
    private IppAuthConfig authConfig;
    private AuthResolver authResolver;
    private JobFiles jobFiles;
    private ConversionDispatcher conversions;

    @BeforeEach
    void initObjectUnderTest() {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        store = new InMemoryPrintStore(clock);
        authConfig = new IppAuthConfig();
        authConfig.setAllowIp(true);
        authConfig.setAllowLogin(true);
        authConfig.setRealm("zikzi");

        User alice = new User("u1", "alice");
        alice.setPasswordHash("hash:T1");
        store.addUser(alice);
        store.addIpRegistration(new IpRegistration("r1", "u1", REGISTERED_IP));

        authResolver = new AuthResolver(authConfig, store, store, store, new NonceCache(clock),
            (storedHash, password) -> storedHash.equals("hash:" + password), clock);
        jobFiles = new JobFiles(jobsDir, ZoneOffset.UTC);
        conversions = mock(ConversionDispatcher.class);
    }

    // ==================== Print-Job ====================

    @Test
    void printJobFromRegisteredIpIsStoredAndQueued() throws Exception {
        // Given
        IppMessage request = request(IppOperation.PRINT_JOB, 11);
        operation(request)
            .add("job-name", IppValue.name("Invoice 42"))
            .add("requesting-user-name", IppValue.name("alice-laptop"))
            .add("document-format", IppValue.mimeMediaType("application/postscript"));

        // When
        IppReply reply = service(false).handle(request, document(DOCUMENT), anonymous(), REGISTERED_IP);

        // Then
        assertThat(reply.isChallenge()).isFalse();
        IppMessage response = reply.getResponse();
        assertThat(response.getCode()).isEqualTo(IppStatus.SUCCESSFUL_OK);
        assertThat(response.getRequestId()).isEqualTo(11);

        List<PrintJob> jobs = store.findRecent(null, 10);
        assertThat(jobs).hasSize(1);
        PrintJob job = jobs.get(0);
        assertThat(job.getUserId()).isEqualTo("u1");
        assertThat(job.getSourceIp()).isEqualTo(REGISTERED_IP);
        assertThat(job.getDocumentName()).isEqualTo("Invoice 42");
        assertThat(job.getHostname()).isEqualTo("alice-laptop");
        assertThat(job.getAppName()).isEqualTo("IPP Client");
        assertThat(job.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(job.getFileSize()).isEqualTo(DOCUMENT.length());
        assertThat(job.getOriginalFile()).endsWith(".ps");
        assertThat(Files.readString(Paths.get(job.getOriginalFile()), StandardCharsets.US_ASCII)).isEqualTo(DOCUMENT);

        IppAttributeGroup jobGroup = response.getGroup(IppTag.JOB).orElseThrow();
        assertThat(jobGroup.find("job-id").orElseThrow().getFirst().asInt()).isEqualTo(1);
        assertThat(jobGroup.find("job-uri").orElseThrow().getFirst().asString())
            .isEqualTo(PRINTER_URI + "/jobs/" + job.getId());
        assertThat(jobGroup.find("job-state").orElseThrow().getFirst().asInt()).isEqualTo(5);
        assertThat(jobGroup.find("job-state-reasons").orElseThrow().getFirst().asString()).isEqualTo("job-printing");
        verify(conversions).dispatch(any(PrintJob.class));
    }

    @Test
    void pdfDocumentFormatKeepsPdfExtension() {
        IppMessage request = request(IppOperation.PRINT_JOB, 1);
        operation(request).add("document-format", IppValue.mimeMediaType("application/pdf"));

        service(false).handle(request, document("%PDF-1.4\n"), anonymous(), REGISTERED_IP);

        assertThat(store.findRecent(null, 1).get(0).getOriginalFile()).endsWith(".pdf");
    }

    @Test
    void unwritableJobsDirectoryFailsJobAndLeavesQueueEmpty() throws Exception {
        // Given
        Path blocker = Files.writeString(jobsDir.resolve("blocker"), "not a directory");
        jobFiles = new JobFiles(blocker.resolve("jobs"), ZoneOffset.UTC);
        IppService service = service(false);

        // When
        IppReply reply = service.handle(request(IppOperation.PRINT_JOB, 4), document(DOCUMENT), anonymous(),
            REGISTERED_IP);

        // Then
        assertThat(reply.getResponse().getCode()).isEqualTo(IppStatus.SERVER_ERROR_INTERNAL_ERROR);
        PrintJob job = store.findRecent(null, 1).get(0);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getError()).startsWith("failed to store document: ");
        assertThat(job.getProcessedAt()).isEqualTo(clock.instant());
        verify(conversions, never()).dispatch(any(PrintJob.class));

        IppReply printer = service.handle(request(IppOperation.GET_PRINTER_ATTRIBUTES, 5), Unpooled.EMPTY_BUFFER,
            anonymous(), REGISTERED_IP);
        assertThat(printer.getResponse().getGroup(IppTag.PRINTER).orElseThrow()
            .find("queued-job-count").orElseThrow().getFirst().asInt()).isZero();
    }

    @Test
    void rejectedConversionIsReportedAsAborted() {
        // Given
        when(conversions.dispatch(any(PrintJob.class))).thenThrow(new RejectedExecutionException("shut down"));

        // When
        IppReply reply = service(false).handle(request(IppOperation.PRINT_JOB, 6), document(DOCUMENT), anonymous(),
            REGISTERED_IP);

        // Then
        IppAttributeGroup jobGroup = reply.getResponse().getGroup(IppTag.JOB).orElseThrow();
        assertThat(reply.getResponse().getCode()).isEqualTo(IppStatus.SUCCESSFUL_OK);
        assertThat(jobGroup.find("job-state").orElseThrow().getFirst().asInt()).isEqualTo(8);
        assertThat(jobGroup.find("job-state-reasons").orElseThrow().getFirst().asString())
            .isEqualTo("job-aborted-by-system");
    }

    @Test
    void printJobWithBasicCredentialsIsAttributedToUser() {
        IppMessage request = request(IppOperation.PRINT_JOB, 1);

        IppReply reply = service(false).handle(request, document(DOCUMENT),
            new AuthRequest("POST", basic("alice", "T1")), "10.0.0.50");

        assertThat(reply.getResponse().getCode()).isEqualTo(IppStatus.SUCCESSFUL_OK);
        assertThat(store.findRecent(null, 1).get(0).getUserId()).isEqualTo("u1");
    }

    @Test
    void unknownClientIsChallengedWhenLoginIsAllowed() {
        // Given
        IppMessage request = request(IppOperation.PRINT_JOB, 1);

        // When
        IppReply reply = service(false).handle(request, document(DOCUMENT), anonymous(), "10.0.0.50");

        // Then
        assertThat(reply.isChallenge()).isTrue();
        assertThat(reply.getChallenges()).hasSize(2);
        assertThat(reply.getChallenges().get(0)).isEqualTo("Basic realm=\"zikzi\"");
        assertThat(reply.getChallenges().get(1)).startsWith("Digest realm=\"zikzi\", nonce=\"");
        assertThat(store.findRecent(null, 10)).isEmpty();
    }

    @Test
    void unknownClientIsRefusedWhenAnonymousIsDisallowed() {
        authConfig.setAllowLogin(false);

        IppReply reply = service(false).handle(request(IppOperation.PRINT_JOB, 9), document(DOCUMENT),
            anonymous(), "10.0.0.50");

        assertThat(reply.isChallenge()).isFalse();
        assertThat(reply.getResponse().getCode()).isEqualTo(IppStatus.CLIENT_ERROR_NOT_AUTHORIZED);
        assertThat(reply.getResponse().getRequestId()).isEqualTo(9);
        verify(conversions, never()).dispatch(any(PrintJob.class));
    }

    @Test
    void unknownClientCreatesOrphanedJobWhenAnonymousIsAllowed() {
        authConfig.setAllowLogin(false);

        IppReply reply = service(true).handle(request(IppOperation.PRINT_JOB, 1), document(DOCUMENT),
            anonymous(), "10.0.0.50");

        assertThat(reply.getResponse().getCode()).isEqualTo(IppStatus.SUCCESSFUL_OK);
        PrintJob job = store.findRecent(null, 1).get(0);
        assertThat(job.isOrphaned()).isTrue();
        assertThat(job.getSourceIp()).isEqualTo("10.0.0.50");
    }

    @Test
    void printJobWithoutDocumentIsBadRequest() {
        IppReply reply = service(false).handle(request(IppOperation.PRINT_JOB, 1), Unpooled.EMPTY_BUFFER,
            anonymous(), REGISTERED_IP);

        assertThat(reply.getResponse().getCode()).isEqualTo(IppStatus.CLIENT_ERROR_BAD_REQUEST);
        assertThat(store.findRecent(null, 10)).isEmpty();
    }

    // ==================== Other operations ====================

    @Test
    void printerAttributesNeedNoCredentials() {
        // Given
        PrintJob queued = store.create(new PrintJob("u1", REGISTERED_IP));
        queued.markProcessing("/tmp/a.ps", 10);
        store.save(queued);
        store.create(new PrintJob(null, "10.0.0.50"));
        PrintJob done = store.create(new PrintJob("u1", REGISTERED_IP));
        done.markProcessing("/tmp/b.ps", 10);
        done.markCompleted("/tmp/b.pdf", null, 1, clock.instant());
        store.save(done);

        // When
        IppReply reply = service(false).handle(request(IppOperation.GET_PRINTER_ATTRIBUTES, 3),
            Unpooled.EMPTY_BUFFER, anonymous(), "10.0.0.50");

        // Then
        assertThat(reply.isChallenge()).isFalse();
        IppAttributeGroup printer = reply.getResponse().getGroup(IppTag.PRINTER).orElseThrow();
        assertThat(printer.find("queued-job-count").orElseThrow().getFirst().asInt()).isEqualTo(2);
        assertThat(printer.find("printer-uri-supported").orElseThrow().getFirst().asString()).isEqualTo(PRINTER_URI);
        assertThat(printer.find("printer-name").orElseThrow().getFirst().asString()).isEqualTo("Zikzi Printer");
        assertThat(printer.find("uri-authentication-supported").orElseThrow().getValues())
            .extracting(IppValue::asString)
            .containsExactly("requesting-user-name", "basic", "digest");
        assertThat(printer.find("operations-supported").orElseThrow().getValues())
            .extracting(IppValue::asInt)
            .contains(IppOperation.PRINT_JOB, IppOperation.GET_JOBS, IppOperation.GET_JOB_ATTRIBUTES);
    }

    @Test
    void authenticationSupportedIsNoneWithoutMethods() {
        authConfig.setAllowIp(false);
        authConfig.setAllowLogin(false);

        IppReply reply = service(false).handle(request(IppOperation.GET_PRINTER_ATTRIBUTES, 3),
            Unpooled.EMPTY_BUFFER, anonymous(), "10.0.0.50");

        assertThat(reply.getResponse().getGroup(IppTag.PRINTER).orElseThrow()
            .find("uri-authentication-supported").orElseThrow().getValues())
            .containsExactly(IppValue.keyword("none"));
    }

    @Test
    void getJobsListsOnlyTheCallersJobs() {
        // Given
        PrintJob first = store.create(new PrintJob("u1", REGISTERED_IP));
        first.setDocumentName("first");
        store.save(first);
        store.create(new PrintJob("u2", "10.0.0.7"));
        PrintJob second = store.create(new PrintJob("u1", REGISTERED_IP));
        second.setDocumentName("second");
        store.save(second);

        // When
        IppReply reply = service(false).handle(request(IppOperation.GET_JOBS, 4), Unpooled.EMPTY_BUFFER,
            anonymous(), REGISTERED_IP);

        // Then
        List<IppAttributeGroup> jobGroups = jobGroups(reply.getResponse());
        assertThat(jobGroups).hasSize(2);
        assertThat(jobGroups.get(0).find("job-name").orElseThrow().getFirst().asString()).isEqualTo("second");
        assertThat(jobGroups.get(0).find("job-id").orElseThrow().getFirst().asInt()).isEqualTo(1);
        assertThat(jobGroups.get(1).find("job-name").orElseThrow().getFirst().asString()).isEqualTo("first");
        assertThat(jobGroups.get(1).find("job-id").orElseThrow().getFirst().asInt()).isEqualTo(2);
        assertThat(jobGroups.get(1).find("job-state").orElseThrow().getFirst().asInt()).isEqualTo(3);
    }

    @Test
    void anonymousGetJobsListsAllJobs() {
        authConfig.setAllowLogin(false);
        store.create(new PrintJob("u1", REGISTERED_IP));
        store.create(new PrintJob("u2", "10.0.0.7"));

        IppReply reply = service(true).handle(request(IppOperation.GET_JOBS, 4), Unpooled.EMPTY_BUFFER,
            anonymous(), "10.0.0.50");

        assertThat(jobGroups(reply.getResponse())).hasSize(2);
    }

    @Test
    void jobAttributesOfCompletedJob() {
        // Given
        PrintJob job = store.create(new PrintJob("u1", REGISTERED_IP));
        job.setDocumentName("Invoice 42");
        job.setHostname("alice-laptop");
        job.markProcessing("/tmp/a.ps", 10);
        job.markCompleted("/tmp/a.pdf", "/tmp/a.png", 3, clock.instant());
        store.save(job);
        IppMessage request = request(IppOperation.GET_JOB_ATTRIBUTES, 5);
        operation(request).add("job-uri", IppValue.uri(PRINTER_URI + "/jobs/" + job.getId()));

        // When
        IppReply reply = service(false).handle(request, Unpooled.EMPTY_BUFFER, anonymous(), "10.0.0.50");

        // Then
        IppAttributeGroup group = reply.getResponse().getGroup(IppTag.JOB).orElseThrow();
        assertThat(group.find("job-state").orElseThrow().getFirst().asInt()).isEqualTo(9);
        assertThat(group.find("job-state-reasons").orElseThrow().getFirst().asString())
            .isEqualTo("job-completed-successfully");
        assertThat(group.find("job-name").orElseThrow().getFirst().asString()).isEqualTo("Invoice 42");
        assertThat(group.find("job-originating-user-name").orElseThrow().getFirst().asString())
            .isEqualTo("alice-laptop");
        assertThat(group.find("job-media-sheets-completed").orElseThrow().getFirst().asInt()).isEqualTo(3);
    }

    @Test
    void jobAttributesWithoutPagesOmitSheetCount() {
        PrintJob job = store.create(new PrintJob("u1", REGISTERED_IP));
        IppMessage request = request(IppOperation.GET_JOB_ATTRIBUTES, 5);
        operation(request).add("job-uri", IppValue.uri(PRINTER_URI + "/jobs/" + job.getId()));

        IppReply reply = service(false).handle(request, Unpooled.EMPTY_BUFFER, anonymous(), "10.0.0.50");

        IppAttributeGroup group = reply.getResponse().getGroup(IppTag.JOB).orElseThrow();
        assertThat(group.find("job-media-sheets-completed")).isEmpty();
        assertThat(group.find("job-state-reasons").orElseThrow().getFirst().asString()).isEqualTo("job-incoming");
    }

    @Test
    void jobAttributesOfUnknownJobIsNotFound() {
        IppMessage request = request(IppOperation.GET_JOB_ATTRIBUTES, 6);
        operation(request).add("job-uri", IppValue.uri(PRINTER_URI + "/jobs/nosuchid"));

        IppReply reply = service(false).handle(request, Unpooled.EMPTY_BUFFER, anonymous(), "10.0.0.50");

        assertThat(reply.getResponse().getCode()).isEqualTo(IppStatus.CLIENT_ERROR_NOT_FOUND);
    }

    @Test
    void jobAttributesWithoutJobUriIsBadRequest() {
        IppReply reply = service(false).handle(request(IppOperation.GET_JOB_ATTRIBUTES, 6),
            Unpooled.EMPTY_BUFFER, anonymous(), "10.0.0.50");

        assertThat(reply.getResponse().getCode()).isEqualTo(IppStatus.CLIENT_ERROR_BAD_REQUEST);
    }

    @Test
    void jobUriWithTrailingSlashIsBadRequest() {
        IppMessage request = request(IppOperation.GET_JOB_ATTRIBUTES, 6);
        operation(request).add("job-uri", IppValue.uri(PRINTER_URI + "/jobs/"));

        IppReply reply = service(false).handle(request, Unpooled.EMPTY_BUFFER, anonymous(), "10.0.0.50");

        assertThat(reply.getResponse().getCode()).isEqualTo(IppStatus.CLIENT_ERROR_BAD_REQUEST);
    }

    @Test
    void validateAndCancelSucceedWithoutEffect() {
        IppService service = service(false);

        assertThat(service.handle(request(IppOperation.VALIDATE_JOB, 1), Unpooled.EMPTY_BUFFER, anonymous(),
            REGISTERED_IP).getResponse().getCode()).isEqualTo(IppStatus.SUCCESSFUL_OK);
        assertThat(service.handle(request(IppOperation.CANCEL_JOB, 2), Unpooled.EMPTY_BUFFER, anonymous(),
            REGISTERED_IP).getResponse().getCode()).isEqualTo(IppStatus.SUCCESSFUL_OK);
        assertThat(store.findRecent(null, 10)).isEmpty();
    }

    @Test
    void unsupportedOperationIsReportedAfterAuthentication() {
        IppService service = service(false);

        IppReply challenged = service.handle(request(0x0010, 1), Unpooled.EMPTY_BUFFER, anonymous(), "10.0.0.50");
        IppReply answered = service.handle(request(0x0010, 1), Unpooled.EMPTY_BUFFER, anonymous(), REGISTERED_IP);

        assertThat(challenged.isChallenge()).isTrue();
        assertThat(answered.getResponse().getCode()).isEqualTo(IppStatus.SERVER_ERROR_OPERATION_NOT_SUPPORTED);
    }

    @Test
    void storeFailureIsInternalError() {
        PrintJobRepository failing = mock(PrintJobRepository.class);
        when(failing.countByStatus(anySet())).thenThrow(new StoreException("database is locked"));
        IppService service = new IppService(PRINTER_URI, authConfig, false, authResolver, failing, jobFiles,
            conversions, clock);

        IppReply reply = service.handle(request(IppOperation.GET_PRINTER_ATTRIBUTES, 7), Unpooled.EMPTY_BUFFER,
            anonymous(), "10.0.0.50");

        assertThat(reply.getResponse().getCode()).isEqualTo(IppStatus.SERVER_ERROR_INTERNAL_ERROR);
        assertThat(reply.getResponse().getRequestId()).isEqualTo(7);
    }

    @Test
    void jobStatesFollowIppEnumeration() {
        assertThat(IppService.jobState(JobStatus.RECEIVED)).isEqualTo(3);
        assertThat(IppService.jobState(JobStatus.PROCESSING)).isEqualTo(5);
        assertThat(IppService.jobState(JobStatus.COMPLETED)).isEqualTo(9);
        assertThat(IppService.jobState(JobStatus.FAILED)).isEqualTo(8);
        assertThat(IppService.jobStateReason(JobStatus.FAILED)).isEqualTo("job-aborted-by-system");
    }

    private IppService service(boolean allowAnonymous) {
        return new IppService(PRINTER_URI, authConfig, allowAnonymous, authResolver, store, jobFiles,
            conversions, clock);
    }

    private static IppMessage request(int operation, int requestId) {
        IppMessage request = new IppMessage(2, 0, operation, requestId);
        request.addGroup(IppTag.OPERATION)
            .add("attributes-charset", IppValue.charset("utf-8"))
            .add("attributes-natural-language", IppValue.naturalLanguage("en"))
            .add("printer-uri", IppValue.uri(PRINTER_URI));
        return request;
    }

    private static IppAttributeGroup operation(IppMessage request) {
        return request.getGroup(IppTag.OPERATION).orElseThrow();
    }

    private static List<IppAttributeGroup> jobGroups(IppMessage response) {
        return response.getGroups().stream()
            .filter(group -> group.getTag() == IppTag.JOB)
            .collect(Collectors.toList());
    }

    private static ByteBuf document(String data) {
        return Unpooled.copiedBuffer(data, StandardCharsets.US_ASCII);
    }

    private static AuthRequest anonymous() {
        return new AuthRequest("POST", null);
    }

    private static String basic(String username, String password) {
        return "Basic " + BaseEncoding.base64().encode((username + ":" + password).getBytes(StandardCharsets.UTF_8));
    }
}
