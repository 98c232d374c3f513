package io.github.manjago.v8decomp.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a dump file whose encoding is not known in advance.
 * <p>
 * Charsets are tried in order with strict decoding. When none decodes the whole
 * file, UTF-8 with replacement characters is used and a warning is logged.
 */
public class SourceReader {

    private static final Logger log = LoggerFactory.getLogger(SourceReader.class);

    private static final char BOM = '\uFEFF';

    private final List<Charset> charsets;

    /**
     * @param charsets decoding attempts, in order
     */
    public SourceReader(List<Charset> charsets) {
        this.charsets = List.copyOf(charsets);
    }

    /**
     * Resolve charset names, skipping the ones this JVM does not support.
     */
    public static SourceReader forNames(List<String> names) {
        List<Charset> resolved = new ArrayList<>();
        for (String name : names) {
            if (Charset.isSupported(name)) {
                resolved.add(Charset.forName(name));
            } else {
                log.warn("Unsupported input encoding '{}', ignored", name);
            }
        }
        return new SourceReader(resolved);
    }

    public List<Charset> getCharsets() {
        return charsets;
    }

    /**
     * Read and split a file into lines.
     *
     * @throws SourceReadException if the file cannot be read
     */
    public List<String> readLines(Path path) throws SourceReadException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new SourceReadException("Failed to read file: " + path, e);
        }
        return splitLines(decode(bytes, path.toString()));
    }

    /**
     * Decode bytes with the first charset that accepts them.
     *
     * @param bytes raw content
     * @param sourceName name used in the fallback warning
     */
    public String decode(byte[] bytes, String sourceName) {
        CharacterCodingException lastError = null;
        for (Charset charset : charsets) {
            CharsetDecoder decoder = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
            try {
                String text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
                log.debug("Decoded {} as {}", sourceName, charset.name());
                return stripBom(text);
            } catch (CharacterCodingException e) {
                lastError = e;
            }
        }
        log.warn("Could not decode {} with {}, falling back to UTF-8 with replacement (last error: {})",
                sourceName, charsets, lastError);
        return stripBom(new String(bytes, StandardCharsets.UTF_8));
    }

    static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>(List.of(text.split("\r\n|\r|\n", -1)));
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    private static String stripBom(String text) {
        return !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
    }

    /**
     * Input could not be read at all.
     */
    public static class SourceReadException extends Exception {
        public SourceReadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
