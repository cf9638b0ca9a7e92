package com.invoicebot.mail.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphAttachment {

    public static final String FILE_ATTACHMENT = "#microsoft.graph.fileAttachment";

    @JsonProperty("@odata.type")
    private String odataType;

    private String id;
    private String name;
    private String contentType;
    private long size;
    @JsonProperty("isInline")
    private boolean inline;

    // only present on the single-attachment endpoint
    private String contentBytes;

    public boolean isFileAttachment() {
        return FILE_ATTACHMENT.equals(odataType);
    }
}
