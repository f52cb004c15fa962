package com.file.dedup.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a file is a text file worth comparing.
 *
 * <p>A file qualifies when its extension is allowed and its first 8 KiB decode as UTF-8 with
 * a high enough share of printable or whitespace characters. A multi-byte sequence cut off
 * by the end of the sample does not count against the file. Empty files are text.</p>
 */
public class TextFileDetector {
    private static final Logger log = LoggerFactory.getLogger(TextFileDetector.class);

    static final int SAMPLE_SIZE = 8 * 1024;

    private final Set<String> allowedExtensions;
    private final double minPrintableRatio;

    public TextFileDetector() {
        this(ScanConfig.DEFAULT_EXTENSIONS, ScanConfig.DEFAULT_MIN_PRINTABLE_RATIO);
    }

    public TextFileDetector(ScanConfig config) {
        this(config.allowedExtensions(), config.minPrintableRatio());
    }

    /**
     * @param allowedExtensions lower-case extensions including the dot; null or empty admits any
     * @param minPrintableRatio threshold in [0, 1]
     */
    public TextFileDetector(Set<String> allowedExtensions, double minPrintableRatio) {
        this.allowedExtensions = allowedExtensions == null ? Set.of() : Set.copyOf(allowedExtensions);
        this.minPrintableRatio = minPrintableRatio;
    }

    /**
     * Returns true if the file passes both the extension and the content check.
     * Unreadable files are not text.
     */
    public boolean isTextFile(Path file) {
        return hasAllowedExtension(file) && hasTextContent(file);
    }

    public boolean hasAllowedExtension(Path file) {
        if (allowedExtensions.isEmpty()) {
            return true;
        }
        return allowedExtensions.contains(extensionOf(file));
    }

    /**
     * Samples the start of the file and applies the UTF-8 and printable-ratio checks.
     */
    public boolean hasTextContent(Path file) {
        byte[] sample;
        try (InputStream in = Files.newInputStream(file)) {
            sample = in.readNBytes(SAMPLE_SIZE);
        } catch (IOException e) {
            log.debug("text.unreadable path={} error={}", file, e.getMessage());
            return false;
        }
        return isText(sample, sample.length == SAMPLE_SIZE);
    }

    /**
     * Applies the content checks to a byte sample.
     *
     * @param sample    leading bytes of a file
     * @param truncated whether the file continues past the sample
     */
    boolean isText(byte[] sample, boolean truncated) {
        if (sample.length == 0) {
            return true;
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        CharBuffer chars = CharBuffer.allocate(sample.length);
        ByteBuffer bytes = ByteBuffer.wrap(sample);
        CoderResult result = decoder.decode(bytes, chars, !truncated);
        if (result.isError()) {
            return false;
        }
        if (!truncated) {
            if (decoder.flush(chars).isError()) {
                return false;
            }
        }
        chars.flip();
        String content = chars.toString();
        if (content.isEmpty()) {
            return true;
        }

        int total = 0;
        int printable = 0;
        for (int i = 0; i < content.length(); ) {
            int cp = content.codePointAt(i);
            total++;
            if (isPrintable(cp) || Character.isWhitespace(cp)) {
                printable++;
            }
            i += Character.charCount(cp);
        }
        return (double) printable / total >= minPrintableRatio;
    }

    static boolean isPrintable(int codePoint) {
        if (codePoint == ' ') {
            return true;
        }
        switch (Character.getType(codePoint)) {
            case Character.CONTROL:
            case Character.FORMAT:
            case Character.SURROGATE:
            case Character.PRIVATE_USE:
            case Character.UNASSIGNED:
            case Character.LINE_SEPARATOR:
            case Character.PARAGRAPH_SEPARATOR:
            case Character.SPACE_SEPARATOR:
                return false;
            default:
                return true;
        }
    }

    static String extensionOf(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return "";
        }
        String s = name.toString();
        int dot = s.lastIndexOf('.');
        return dot > 0 ? s.substring(dot).toLowerCase(Locale.ROOT) : "";
    }
}
