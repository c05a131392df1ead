package me.internalizable.zikzi.conversion;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * The Ghostscript invocations used to turn a submitted document into a PDF, a thumbnail
 * and a page count.
 */
public class Ghostscript {

    private static final Logger LOGGER = LoggerFactory.getLogger(Ghostscript.class);

    public static final int THUMBNAIL_RESOLUTION = 150;

    private final String binary;
    private final ProcessRunner runner;
    private final Duration timeout;

    public Ghostscript(@Nonnull String binary, @Nonnull ProcessRunner runner, @Nonnull Duration timeout) {
        this.binary = binary == null || binary.isEmpty() ? "gs" : binary;
        this.runner = Objects.requireNonNull(runner, "runner");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * Converts a PostScript or PDF file to a PDF 1.4 without downsampling or recompressing
     * images.
     */
    public void convertToPdf(@Nonnull Path input, @Nonnull Path output) throws ConversionException {
        execute(ImmutableList.of(
            binary,
            "-dNOPAUSE",
            "-dBATCH",
            "-dSAFER",
            "-sDEVICE=pdfwrite",
            "-dCompatibilityLevel=1.4",
            "-dPDFSETTINGS=/prepress",
            "-dColorConversionStrategy=/LeaveColorUnchanged",
            "-dDownsampleMonoImages=false",
            "-dDownsampleGrayImages=false",
            "-dDownsampleColorImages=false",
            "-dAutoFilterColorImages=false",
            "-dAutoFilterGrayImages=false",
            "-sOutputFile=" + output,
            input.toString()
        ));
    }

    /**
     * Renders the first page as a 24-bit PNG.
     */
    public void renderThumbnail(@Nonnull Path input, @Nonnull Path output) throws ConversionException {
        execute(ImmutableList.of(
            binary,
            "-dNOPAUSE",
            "-dBATCH",
            "-dSAFER",
            "-sDEVICE=png16m",
            "-r" + THUMBNAIL_RESOLUTION,
            "-dFirstPage=1",
            "-dLastPage=1",
            "-sOutputFile=" + output,
            input.toString()
        ));
    }

    /**
     * Asks Ghostscript for the page count of a PDF.
     *
     * @throws ConversionException if the call fails or prints no positive number
     */
    public int countPdfPages(@Nonnull Path pdf) throws ConversionException {
        String output = execute(ImmutableList.of(
            binary,
            "-dNODISPLAY",
            "-dQUIET",
            "-dNOPAUSE",
            "-dBATCH",
            "-c",
            "(" + pdf + ") (r) file runpdfbegin pdfpagecount == quit"
        )).trim();
        try {
            int count = Integer.parseInt(output);
            if (count < 1) {
                throw new ConversionException("Non-positive page count: " + count);
            }
            return count;
        } catch (NumberFormatException e) {
            throw new ConversionException("Unparseable page count: " + output, e);
        }
    }

    private String execute(List<String> command) throws ConversionException {
        LOGGER.debug("Running {}", command);
        ProcessOutput result;
        try {
            result = runner.run(command, timeout);
        } catch (IOException e) {
            throw new ConversionException("ghostscript could not be run: " + e.getMessage(), e);
        }
        if (result.isTimedOut()) {
            throw new ConversionException("ghostscript timed out after " + timeout.getSeconds() + " s");
        }
        if (!result.isSuccess()) {
            throw new ConversionException("ghostscript error: exit status " + result.getExitCode()
                + ", output: " + result.getOutput());
        }
        return result.getOutput();
    }
}
