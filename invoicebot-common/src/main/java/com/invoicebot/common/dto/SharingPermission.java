package com.invoicebot.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Answer of {@code createLink}: the permission that carries the sharing link.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SharingPermission {
    private String id;
    private Link link;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Link {
        private String type;
        private String scope;
        private String webUrl;
    }
}
