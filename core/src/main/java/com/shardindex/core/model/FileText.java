package com.shardindex.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.ToString;
import lombok.Value;

/**
 * Path and full text of one source file, as shipped to a worker.
 */
@Value
public class FileText {
    @JsonProperty("path")
    String path;

    @ToString.Exclude
    @JsonProperty("text")
    String text;

    @JsonCreator
    public FileText(
            @JsonProperty("path") String path,
            @JsonProperty("text") String text
    ) {
        this.path = path;
        this.text = text;
    }
}
