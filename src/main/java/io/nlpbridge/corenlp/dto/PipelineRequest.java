package io.nlpbridge.corenlp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Pipeline configuration request; every field is optional and falls back to the configured defaults.
 *
 * @param modelOverrides model key to path relative to the family folder, applied before resolution
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PipelineRequest(
        @JsonProperty("language") String language,
        @JsonProperty("annotators") List<String> annotators,
        @JsonProperty("customProperties") Map<String, String> customProperties,
        @JsonProperty("modelOverrides") Map<String, String> modelOverrides
) {}
