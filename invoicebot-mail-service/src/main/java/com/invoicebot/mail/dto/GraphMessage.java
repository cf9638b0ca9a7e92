package com.invoicebot.mail.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * Message as returned by {@code /me/mailFolders/{folder}/messages} with the
 * {@code id,sender,subject,receivedDateTime,hasAttachments,body} projection.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphMessage {

    private String id;
    private Recipient sender;
    private String subject;
    private OffsetDateTime receivedDateTime;
    private boolean hasAttachments;
    private ItemBody body;

    /** Lowercased sender address, or an empty string when Graph sent none. */
    public String senderAddress() {
        if (sender == null || sender.getEmailAddress() == null || sender.getEmailAddress().getAddress() == null) {
            return "";
        }
        return sender.getEmailAddress().getAddress().trim().toLowerCase();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Recipient {
        private EmailAddress emailAddress;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmailAddress {
        private String name;
        private String address;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ItemBody {
        private String contentType; // "html" or "text"
        private String content;

        public boolean isHtml() {
            return "html".equalsIgnoreCase(contentType);
        }
    }
}
