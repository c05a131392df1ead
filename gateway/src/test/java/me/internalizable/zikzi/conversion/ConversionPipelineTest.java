package me.internalizable.zikzi.conversion;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversionPipelineTest {

    @TempDir
    Path dir;

    private Ghostscript ghostscript;
    private ConversionPipeline pipeline;
    private Path original;

    @BeforeEach
    void initObjectUnderTest() throws Exception {
        ghostscript = mock(Ghostscript.class);
        pipeline = new ConversionPipeline(ghostscript);
        original = dir.resolve("abc_20240301_100000.ps");
        Files.writeString(original, "%!PS\n%%Page: 1 1\nshowpage\n%%Page: 2 2\nshowpage\n%%Page: 3 3\nshowpage\n",
            StandardCharsets.US_ASCII);
    }

    @Test
    void convertsToPdfWithThumbnailAndPageCount() throws Exception {
        // Given
        when(ghostscript.countPdfPages(dir.resolve("abc.pdf"))).thenReturn(5);

        // When
        ConversionResult result = pipeline.run(original, dir, "abc");

        // Then
        assertThat(result.hasPdf()).isTrue();
        assertThat(result.getPdfPath()).isEqualTo(dir.resolve("abc.pdf").toString());
        assertThat(result.getThumbnailPath()).isEqualTo(dir.resolve("abc_thumb.png").toString());
        assertThat(result.getPageCount()).isEqualTo(5);
        assertThat(result.getError()).isNull();
        verify(ghostscript).convertToPdf(original, dir.resolve("abc.pdf"));
        verify(ghostscript).renderThumbnail(dir.resolve("abc.pdf"), dir.resolve("abc_thumb.png"));
    }

    @Test
    void pdfFailureEndsTheRun() throws Exception {
        doThrow(new ConversionException("ghostscript error: exit status 1"))
            .when(ghostscript).convertToPdf(any(Path.class), any(Path.class));

        ConversionResult result = pipeline.run(original, dir, "abc");

        assertThat(result.hasPdf()).isFalse();
        assertThat(result.getError()).isEqualTo("PDF conversion failed: ghostscript error: exit status 1");
        verify(ghostscript, never()).renderThumbnail(any(Path.class), any(Path.class));
    }

    @Test
    void thumbnailFailureKeepsPdf() throws Exception {
        doThrow(new ConversionException("timed out"))
            .when(ghostscript).renderThumbnail(any(Path.class), any(Path.class));
        when(ghostscript.countPdfPages(any(Path.class))).thenReturn(2);

        ConversionResult result = pipeline.run(original, dir, "abc");

        assertThat(result.hasPdf()).isTrue();
        assertThat(result.getThumbnailPath()).isNull();
        assertThat(result.getPageCount()).isEqualTo(2);
        assertThat(result.getError()).isEqualTo("thumbnail generation failed: timed out");
    }

    @Test
    void pageCountFallsBackToDscComments() throws Exception {
        when(ghostscript.countPdfPages(any(Path.class))).thenThrow(new ConversionException("Unparseable"));

        assertThat(pipeline.run(original, dir, "abc").getPageCount()).isEqualTo(3);
    }

    @Test
    void pageCountDefaultsToOne() throws Exception {
        Files.writeString(original, "%!PS\nshowpage\n", StandardCharsets.US_ASCII);
        when(ghostscript.countPdfPages(any(Path.class))).thenThrow(new ConversionException("Unparseable"));

        assertThat(pipeline.run(original, dir, "abc").getPageCount()).isEqualTo(1);
    }

    @Test
    void unreadableFileHasNoDscPages() {
        assertThat(ConversionPipeline.countDscPages(dir.resolve("missing.ps"))).isZero();
    }
}
