package com.invoicebot.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DriveItem {
    private String id;
    private String name;
    private String webUrl;
    private Long size;
}
