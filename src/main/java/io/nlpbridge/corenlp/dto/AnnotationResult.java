package io.nlpbridge.corenlp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Output of running a pipeline over a text
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnnotationResult(
        @JsonProperty("language") String language,
        @JsonProperty("annotators") List<String> annotators,
        @JsonProperty("sentences") List<AnnotatedSentence> sentences,
        @JsonProperty("processingTimeMs") long processingTimeMs
) {

    /**
     * Result for blank input, no pipeline involved
     */
    public static AnnotationResult empty(String language, List<String> annotators) {
        return new AnnotationResult(language, annotators, Collections.emptyList(), 0);
    }

    public int getTokenCount() {
        return sentences.stream()
                .mapToInt(sentence -> sentence.tokens().size())
                .sum();
    }

    /**
     * Named entity tokens grouped by tag, "O" excluded
     */
    public Map<String, List<String>> getEntities() {
        return sentences.stream()
                .flatMap(sentence -> sentence.tokens().stream())
                .filter(token -> token.ner() != null && !"O".equals(token.ner()))
                .collect(Collectors.groupingBy(AnnotatedToken::ner,
                        Collectors.mapping(AnnotatedToken::word, Collectors.toList())));
    }
}
