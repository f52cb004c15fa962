package com.file.dedup.signature;

import com.file.dedup.core.model.Signature;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Incremental signer for content that arrives as byte chunks of any size.
 *
 * <p>Bytes are decoded as strict UTF-8 (a multi-byte sequence may be split across chunks),
 * normalized, and shingled through a sliding window that always retains the last
 * {@code k - 1} characters, so no shingle straddling a chunk boundary is lost. The result
 * equals {@link SignatureEngine#sign(String)} over the same content.</p>
 *
 * <p>Single use and not thread-safe. Obtain instances from {@link SignatureEngine#newStreamingSigner()}.</p>
 */
public class StreamingSigner {

    private final MinHasher hasher;
    private final int shingleSize;
    private final long[] mins;
    private final CharsetDecoder decoder;
    private final TextNormalizer normalizer = new TextNormalizer();
    private final StringBuilder window = new StringBuilder();
    private final CharBuffer decoded = CharBuffer.allocate(4096);
    private ByteBuffer leftover = ByteBuffer.allocate(0);
    private long normalizedLength;
    private boolean finished;

    StreamingSigner(MinHasher hasher, int shingleSize) {
        this.hasher = hasher;
        this.shingleSize = shingleSize;
        this.mins = hasher.newAccumulator();
        this.decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    /**
     * Feeds the next chunk of bytes.
     *
     * @throws SigningException if the bytes are not valid UTF-8
     */
    public StreamingSigner update(byte[] chunk) {
        return update(chunk, 0, chunk.length);
    }

    public StreamingSigner update(byte[] chunk, int offset, int length) {
        checkNotFinished();
        ByteBuffer input;
        if (leftover.hasRemaining()) {
            input = ByteBuffer.allocate(leftover.remaining() + length);
            input.put(leftover).put(chunk, offset, length).flip();
        } else {
            input = ByteBuffer.wrap(chunk, offset, length);
        }
        decode(input, false);
        if (input.hasRemaining()) {
            ByteBuffer rest = ByteBuffer.allocate(input.remaining());
            rest.put(input).flip();
            leftover = rest;
        } else {
            leftover = ByteBuffer.allocate(0);
        }
        return this;
    }

    /**
     * Feeds the remaining bytes of a buffer. The buffer's position is advanced to its limit.
     */
    public StreamingSigner update(ByteBuffer chunk) {
        byte[] bytes = new byte[chunk.remaining()];
        chunk.get(bytes);
        return update(bytes, 0, bytes.length);
    }

    /**
     * Feeds already-decoded characters.
     */
    public StreamingSigner update(CharSequence text) {
        checkNotFinished();
        consume(text);
        return this;
    }

    /**
     * Completes the signature. A document that normalized to nothing yields
     * {@link Signature#empty(int)}.
     *
     * @throws SigningException if the input ends inside a multi-byte sequence
     */
    public Signature finish() {
        checkNotFinished();
        decode(leftover, true);
        decoded.clear();
        CoderResult flush = decoder.flush(decoded);
        if (flush.isError()) {
            throw new SigningException("Failed to decode content as UTF-8", toCodingException(flush));
        }
        decoded.flip();
        consume(decoded);
        finished = true;

        if (normalizedLength == 0) {
            return Signature.empty(mins.length);
        }
        if (normalizedLength < shingleSize) {
            // whole document is a single shingle
            hasher.update(mins, MinHasher.baseHash(window, 0, window.length()));
        }
        return Signature.of(mins);
    }

    private void decode(ByteBuffer input, boolean endOfInput) {
        while (true) {
            decoded.clear();
            CoderResult result = decoder.decode(input, decoded, endOfInput);
            decoded.flip();
            consume(decoded);
            if (result.isError()) {
                throw new SigningException("Failed to decode content as UTF-8", toCodingException(result));
            }
            if (result.isUnderflow()) {
                return;
            }
        }
    }

    private void consume(CharSequence chars) {
        if (chars.length() == 0) {
            return;
        }
        normalizedLength += normalizer.feed(chars, window);
        int length = window.length();
        if (length < shingleSize) {
            return;
        }
        hasher.foldShingles(window, 0, length, shingleSize, mins);
        window.delete(0, length - (shingleSize - 1));
    }

    private void checkNotFinished() {
        if (finished) {
            throw new IllegalStateException("StreamingSigner already finished");
        }
    }

    private static CharacterCodingException toCodingException(CoderResult result) {
        try {
            result.throwException();
        } catch (CharacterCodingException e) {
            return e;
        }
        return new CharacterCodingException();
    }
}
