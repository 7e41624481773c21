package com.tessera.threads;

import java.util.Objects;

/** A piece of streamed message content. */
public sealed interface ContentChunk permits ContentChunk.Delta, ContentChunk.Complete, ContentChunk.Failure {

    static ContentChunk delta(String text) {
        return new Delta(text);
    }

    static ContentChunk complete() {
        return new Complete();
    }

    static ContentChunk failure(String reason) {
        return new Failure(reason);
    }

    /** More text for the message being streamed. */
    record Delta(String text) implements ContentChunk {
        public Delta {
            Objects.requireNonNull(text, "text");
        }
    }

    /** The producer is done; the accumulated text is the message. */
    record Complete() implements ContentChunk {}

    /** The producer gave up; nothing is appended. */
    record Failure(String reason) implements ContentChunk {}
}
