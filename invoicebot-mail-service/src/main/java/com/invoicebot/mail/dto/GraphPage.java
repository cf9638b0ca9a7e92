package com.invoicebot.mail.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of a Graph collection. {@code nextLink} is an absolute URL that
 * already carries every query parameter of the original request.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphPage<T> {

    private List<T> value = new ArrayList<>();

    @JsonProperty("@odata.nextLink")
    private String nextLink;
}
