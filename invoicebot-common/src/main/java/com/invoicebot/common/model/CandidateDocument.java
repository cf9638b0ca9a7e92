package com.invoicebot.common.model;

/**
 * One classifiable unit of content: an attachment, an archive member or a
 * link download. Containers are expanded before a document reaches the
 * classifier.
 */
public record CandidateDocument(
        String name,
        String mediaType,
        byte[] content,
        DocumentOrigin origin
) {
    public CandidateDocument {
        if (name == null || name.isBlank()) {
            name = "attachment";
        }
        mediaType = SupportedMediaTypes.normalize(mediaType);
        if (content == null) {
            content = new byte[0];
        }
        if (origin == null) {
            origin = DocumentOrigin.ATTACHMENT;
        }
    }

    public static CandidateDocument attachment(String name, String mediaType, byte[] content) {
        return new CandidateDocument(name, mediaType, content, DocumentOrigin.ATTACHMENT);
    }

    public int size() {
        return content.length;
    }

    public boolean isContainer() {
        return SupportedMediaTypes.isContainer(mediaType, name);
    }

    @Override
    public String toString() {
        return "CandidateDocument{name='" + name + "', mediaType='" + mediaType
                + "', size=" + content.length + ", origin=" + origin + '}';
    }
}
