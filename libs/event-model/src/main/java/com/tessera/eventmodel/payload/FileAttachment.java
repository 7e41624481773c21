package com.tessera.eventmodel.payload;

/**
 * Inline file sent with a create command.
 *
 * @param content file body, plain text or base64 depending on {@code encoding}
 * @param filename original file name; its extension picks the stored object's suffix
 * @param contentType MIME type (defaults to {@code text/markdown})
 * @param encoding how {@code content} is encoded
 */
public record FileAttachment(String content, String filename, String contentType, Encoding encoding) {

    public enum Encoding {
        TEXT,
        BASE64
    }

    public FileAttachment {
        if (contentType == null || contentType.isBlank()) {
            contentType = "text/markdown";
        }
        if (encoding == null) {
            encoding = Encoding.TEXT;
        }
    }

    /** File extension without the dot, {@code md} when the name has none. */
    public String extension() {
        if (filename == null) {
            return "md";
        }
        int dot = filename.lastIndexOf('.');
        return dot < 0 || dot == filename.length() - 1 ? "md" : filename.substring(dot + 1);
    }
}
