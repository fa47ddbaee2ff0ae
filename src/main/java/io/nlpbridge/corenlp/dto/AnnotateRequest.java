package io.nlpbridge.corenlp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AnnotateRequest(
        @JsonProperty("text") String text,
        @JsonProperty("language") String language,
        @JsonProperty("annotators") List<String> annotators
) {}
