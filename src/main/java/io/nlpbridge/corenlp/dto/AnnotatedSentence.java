package io.nlpbridge.corenlp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AnnotatedSentence(
        @JsonProperty("index") int index,
        @JsonProperty("text") String text,
        @JsonProperty("tokens") List<AnnotatedToken> tokens
) {}
