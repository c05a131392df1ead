package me.internalizable.zikzi.conversion;

import javax.annotation.Nullable;

/**
 * Outcome of one {@link ConversionPipeline#run} call.
 *
 * <p>A result without a PDF is a failure. A result with a PDF may still carry an error when
 * the thumbnail could not be rendered.</p>
 */
public final class ConversionResult {

    private final String pdfPath;
    private final String thumbnailPath;
    private final int pageCount;
    private final String error;

    private ConversionResult(String pdfPath, String thumbnailPath, int pageCount, String error) {
        this.pdfPath = pdfPath;
        this.thumbnailPath = thumbnailPath;
        this.pageCount = pageCount;
        this.error = error;
    }

    public static ConversionResult failed(String error) {
        return new ConversionResult(null, null, 0, error);
    }

    public static ConversionResult converted(String pdfPath, @Nullable String thumbnailPath,
                                             int pageCount, @Nullable String error) {
        return new ConversionResult(pdfPath, thumbnailPath, pageCount, error);
    }

    @Nullable
    public String getPdfPath() {
        return pdfPath;
    }

    @Nullable
    public String getThumbnailPath() {
        return thumbnailPath;
    }

    public int getPageCount() {
        return pageCount;
    }

    @Nullable
    public String getError() {
        return error;
    }

    public boolean hasPdf() {
        return pdfPath != null && !pdfPath.isEmpty();
    }

    @Override
    public String toString() {
        return "ConversionResult{pdf=" + pdfPath + ", thumbnail=" + thumbnailPath
            + ", pages=" + pageCount + ", error=" + error + '}';
    }
}
