package com.file.dedup.signature;

/**
 * Lower-cases text and collapses every whitespace run to a single space,
 * dropping leading and trailing whitespace.
 *
 * <p>An instance keeps state between calls to {@link #feed}, so text split into
 * arbitrary pieces normalizes to exactly the same output as the whole text.
 * Not thread-safe.</p>
 */
public class TextNormalizer {

    private boolean emittedAny;
    private boolean pendingSpace;

    /**
     * Normalizes a complete text in one call.
     */
    public static String normalize(CharSequence text) {
        StringBuilder out = new StringBuilder(text.length());
        new TextNormalizer().feed(text, out);
        return out.toString();
    }

    /**
     * Normalizes the next piece of text, appending to {@code out}.
     * A whitespace run is only emitted once a following non-whitespace character arrives.
     *
     * @return number of characters appended
     */
    public int feed(CharSequence in, StringBuilder out) {
        int appended = 0;
        for (int i = 0; i < in.length(); i++) {
            char c = in.charAt(i);
            if (Character.isWhitespace(c)) {
                if (emittedAny) {
                    pendingSpace = true;
                }
                continue;
            }
            if (pendingSpace) {
                out.append(' ');
                appended++;
                pendingSpace = false;
            }
            out.append(Character.toLowerCase(c));
            appended++;
            emittedAny = true;
        }
        return appended;
    }
}
