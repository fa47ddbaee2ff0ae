package io.nlpbridge.corenlp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A token as produced by the pipeline. Tags are null when the annotator producing them was not run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnnotatedToken(
        @JsonProperty("word") String word,
        @JsonProperty("lemma") String lemma,
        @JsonProperty("pos") String pos,
        @JsonProperty("ner") String ner,
        @JsonProperty("beginPosition") int beginPosition,
        @JsonProperty("endPosition") int endPosition
) {}
