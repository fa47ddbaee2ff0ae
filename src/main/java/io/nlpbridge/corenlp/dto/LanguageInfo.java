package io.nlpbridge.corenlp.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.nlpbridge.corenlp.model.AnnotatorFamily;
import io.nlpbridge.corenlp.model.LanguageCode;

import java.util.List;

public record LanguageInfo(
        @JsonProperty("language") LanguageCode language,
        @JsonProperty("codes") List<String> codes,
        @JsonProperty("annotators") List<AnnotatorFamily> annotators
) {}
