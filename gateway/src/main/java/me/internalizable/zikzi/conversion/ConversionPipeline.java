package me.internalizable.zikzi.conversion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Converts one stored document: PDF, first-page thumbnail, page count.
 *
 * <ol>
 *   <li>{@code {jobId}.pdf}: failure ends the run</li>
 *   <li>{@code {jobId}_thumb.png} rendered from the PDF: failure is recorded in the result
 *       but the PDF is kept</li>
 *   <li>page count from Ghostscript, else the number of {@code %%Page:} comments in the
 *       original, else 1</li>
 * </ol>
 */
public class ConversionPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversionPipeline.class);

    private static final String PAGE_COMMENT = "%%Page:";

    private final Ghostscript ghostscript;

    public ConversionPipeline(@Nonnull Ghostscript ghostscript) {
        this.ghostscript = Objects.requireNonNull(ghostscript, "ghostscript");
    }

    @Nonnull
    public ConversionResult run(@Nonnull Path original, @Nonnull Path outputDir, @Nonnull String jobId) {
        Path pdf = outputDir.resolve(jobId + ".pdf");
        Path thumbnail = outputDir.resolve(jobId + "_thumb.png");

        try {
            ghostscript.convertToPdf(original, pdf);
        } catch (ConversionException e) {
            return ConversionResult.failed("PDF conversion failed: " + e.getMessage());
        }

        String thumbnailPath = thumbnail.toString();
        String error = null;
        try {
            ghostscript.renderThumbnail(pdf, thumbnail);
        } catch (ConversionException e) {
            thumbnailPath = null;
            error = "thumbnail generation failed: " + e.getMessage();
        }

        return ConversionResult.converted(pdf.toString(), thumbnailPath, countPages(pdf, original), error);
    }

    private int countPages(Path pdf, Path original) {
        try {
            return ghostscript.countPdfPages(pdf);
        } catch (ConversionException e) {
            LOGGER.debug("Ghostscript page count for {} failed, counting DSC pages: {}", pdf, e.getMessage());
        }
        int pages = countDscPages(original);
        return pages > 0 ? pages : 1;
    }

    /**
     * Counts {@code %%Page:} comment lines, 0 when the file can not be read.
     */
    static int countDscPages(Path file) {
        int pages = 0;
        // Latin-1 maps every byte, binary sections can not break decoding
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.ISO_8859_1)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.startsWith(PAGE_COMMENT)) {
                    pages++;
                }
            }
        } catch (IOException e) {
            LOGGER.warn("Failed to scan {} for page comments", file, e);
            return 0;
        }
        return pages;
    }
}
