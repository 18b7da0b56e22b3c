package org.quillmark.parse.text;

import org.quillmark.parse.Parsed;

/**
 * The decision of a {@link Delimiter} at a start character.
 */
public sealed interface DelimiterResult<T> permits DelimiterResult.Continue, DelimiterResult.Complete {

    /**
     * The character did not complete the delimiter; scanning goes on.
     */
    record Continue<T>() implements DelimiterResult<T> {}

    /**
     * The scan is finished with the given outcome.
     * @param result The outcome of the scan.
     */
    record Complete<T>(Parsed<T> result) implements DelimiterResult<T> {}

    static <T> DelimiterResult<T> proceed() {
        return new Continue<>();
    }

    static <T> DelimiterResult<T> complete(Parsed<T> result) {
        return new Complete<>(result);
    }
}
