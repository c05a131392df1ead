package me.internalizable.zikzi.raw;

import com.google.common.base.CharMatcher;
import io.netty.buffer.ByteBuf;

import javax.annotation.Nonnull;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Incremental parser for PostScript DSC comments.
 *
 * <p>Bytes are fed as they arrive off the wire; only the current line is buffered, and
 * only if it can still be a comment ({@code %%} or {@code %!}). Lines end at LF with an
 * optional trailing CR. Scanning continues past {@code %%EndComments}, and a field seen
 * twice keeps its last value. Lines longer than {@link #MAX_LINE_LENGTH} are skipped.</p>
 *
 * <p>Not thread-safe; one instance per connection.</p>
 */
public final class DscMetadataParser {

    static final int MAX_LINE_LENGTH = 64 * 1024;

    private static final Pattern TITLE = Pattern.compile("^%%Title:\\s*(.+)$");
    private static final Pattern CREATOR = Pattern.compile("^%%Creator:\\s*(.+)$");
    private static final Pattern CREATION_DATE = Pattern.compile("^%%CreationDate:\\s*(.+)$");
    private static final Pattern FOR = Pattern.compile("^%%For:\\s*(.+)$");
    private static final Pattern PAGES = Pattern.compile("^%%Pages:\\s*(\\d{1,9})\\b");
    private static final Pattern BOUNDING_BOX = Pattern.compile("^%%BoundingBox:\\s*(.+)$");

    private static final CharMatcher PARENTHESES = CharMatcher.anyOf("()");

    private final PostScriptMetadata metadata = new PostScriptMetadata();
    private final ByteArrayOutputStream line = new ByteArrayOutputStream(256);

    // Current line can not be a comment or is too long; drop bytes until LF
    private boolean skipping;

    /**
     * Feeds the readable bytes of the buffer without consuming them.
     */
    public void feed(@Nonnull ByteBuf buf) {
        int end = buf.writerIndex();
        for (int i = buf.readerIndex(); i < end; i++) {
            accept(buf.getByte(i));
        }
    }

    /**
     * Processes a final unterminated line and returns the collected fields.
     */
    @Nonnull
    public PostScriptMetadata finish() {
        if (!skipping && line.size() > 0) {
            processLine();
        }
        line.reset();
        skipping = false;
        return metadata;
    }

    private void accept(byte b) {
        if (b == '\n') {
            if (!skipping) {
                processLine();
            }
            line.reset();
            skipping = false;
            return;
        }
        if (skipping) {
            return;
        }

        line.write(b);
        int size = line.size();
        if (size == 1 && b != '%') {
            skipping = true;
        } else if (size == 2 && b != '%' && b != '!') {
            skipping = true;
        } else if (size > MAX_LINE_LENGTH) {
            skipping = true;
        }
        if (skipping) {
            line.reset();
        }
    }

    private void processLine() {
        String text = line.toString(StandardCharsets.UTF_8);
        if (text.endsWith("\r")) {
            text = text.substring(0, text.length() - 1);
        }
        if (!text.startsWith("%%") && !text.startsWith("%!")) {
            return;
        }

        Matcher m;
        if ((m = TITLE.matcher(text)).find()) {
            metadata.setTitle(PARENTHESES.trimFrom(m.group(1).trim()));
        } else if ((m = CREATOR.matcher(text)).find()) {
            metadata.setCreator(m.group(1).trim());
        } else if ((m = CREATION_DATE.matcher(text)).find()) {
            metadata.setCreationDate(m.group(1).trim());
        } else if ((m = FOR.matcher(text)).find()) {
            metadata.setFor(PARENTHESES.trimFrom(m.group(1).trim()));
        } else if ((m = PAGES.matcher(text)).find()) {
            metadata.setPages(Integer.parseInt(m.group(1)));
        } else if ((m = BOUNDING_BOX.matcher(text)).find()) {
            metadata.setBoundingBox(m.group(1).trim());
        }
    }
}
