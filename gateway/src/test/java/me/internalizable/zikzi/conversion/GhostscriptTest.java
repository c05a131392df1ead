package me.internalizable.zikzi.conversion;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GhostscriptTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(120);

    private ProcessRunner runner;
    private Ghostscript ghostscript;

    @BeforeEach
    void initObjectUnderTest() {
        runner = mock(ProcessRunner.class);
        ghostscript = new Ghostscript("/usr/bin/gs", runner, TIMEOUT);
    }

    @Test
    void pdfConversionKeepsImagesUntouched() throws Exception {
        // Given
        when(runner.run(anyList(), any(Duration.class))).thenReturn(ProcessOutput.exited(0, ""));
        Path input = Paths.get("/data/jobs/abc_20240301_100000.ps");
        Path output = Paths.get("/data/out/abc.pdf");

        // When
        ghostscript.convertToPdf(input, output);

        // Then
        List<String> command = capturedCommand();
        assertThat(command.get(0)).isEqualTo("/usr/bin/gs");
        assertThat(command).contains(
            "-dSAFER",
            "-sDEVICE=pdfwrite",
            "-dCompatibilityLevel=1.4",
            "-dDownsampleColorImages=false",
            "-dAutoFilterColorImages=false",
            "-sOutputFile=" + output);
        assertThat(command.get(command.size() - 1)).isEqualTo(input.toString());
    }

    @Test
    void thumbnailRendersFirstPageOnly() throws Exception {
        when(runner.run(anyList(), any(Duration.class))).thenReturn(ProcessOutput.exited(0, ""));

        ghostscript.renderThumbnail(Paths.get("abc.pdf"), Paths.get("abc_thumb.png"));

        assertThat(capturedCommand()).contains(
            "-sDEVICE=png16m", "-r150", "-dFirstPage=1", "-dLastPage=1", "-sOutputFile=abc_thumb.png");
    }

    @Test
    void pageCountIsParsedFromOutput() throws Exception {
        when(runner.run(anyList(), eq(TIMEOUT))).thenReturn(ProcessOutput.exited(0, "  7\n"));

        assertThat(ghostscript.countPdfPages(Paths.get("abc.pdf"))).isEqualTo(7);
        assertThat(capturedCommand()).contains("-dNODISPLAY", "-c");
    }

    @Test
    void unparseablePageCountFails() throws Exception {
        when(runner.run(anyList(), any(Duration.class)))
            .thenReturn(ProcessOutput.exited(0, "Error: /undefined in runpdfbegin"));

        assertThatThrownBy(() -> ghostscript.countPdfPages(Paths.get("abc.pdf")))
            .isInstanceOf(ConversionException.class)
            .hasMessageContaining("Unparseable page count");
    }

    @Test
    void zeroPageCountFails() throws Exception {
        when(runner.run(anyList(), any(Duration.class))).thenReturn(ProcessOutput.exited(0, "0"));

        assertThatThrownBy(() -> ghostscript.countPdfPages(Paths.get("abc.pdf")))
            .isInstanceOf(ConversionException.class);
    }

    @Test
    void nonZeroExitCarriesOutput() throws Exception {
        when(runner.run(anyList(), any(Duration.class)))
            .thenReturn(ProcessOutput.exited(1, "Unrecoverable error, exit code 1"));

        assertThatThrownBy(() -> ghostscript.convertToPdf(Paths.get("a.ps"), Paths.get("a.pdf")))
            .isInstanceOf(ConversionException.class)
            .hasMessageContaining("exit status 1")
            .hasMessageContaining("Unrecoverable error");
    }

    @Test
    void timeoutIsReported() throws Exception {
        when(runner.run(anyList(), any(Duration.class))).thenReturn(ProcessOutput.killed(""));

        assertThatThrownBy(() -> ghostscript.convertToPdf(Paths.get("a.ps"), Paths.get("a.pdf")))
            .isInstanceOf(ConversionException.class)
            .hasMessageContaining("timed out after 120 s");
    }

    @Test
    void startFailureIsWrapped() throws Exception {
        when(runner.run(anyList(), any(Duration.class))).thenThrow(new IOException("No such file"));

        assertThatThrownBy(() -> ghostscript.convertToPdf(Paths.get("a.ps"), Paths.get("a.pdf")))
            .isInstanceOf(ConversionException.class)
            .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void emptyBinaryDefaultsToGs() throws Exception {
        Ghostscript defaulted = new Ghostscript("", runner, TIMEOUT);
        when(runner.run(anyList(), any(Duration.class))).thenReturn(ProcessOutput.exited(0, ""));

        defaulted.convertToPdf(Paths.get("a.ps"), Paths.get("a.pdf"));

        assertThat(capturedCommand().get(0)).isEqualTo("gs");
    }

    @SuppressWarnings("unchecked")
    private List<String> capturedCommand() throws IOException {
        ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
        verify(runner).run(command.capture(), eq(TIMEOUT));
        return command.getValue();
    }
}
