package io.nlpbridge.corenlp.service.annotation;

import edu.stanford.nlp.ling.CoreAnnotations;
import edu.stanford.nlp.ling.CoreLabel;
import edu.stanford.nlp.pipeline.Annotation;
import edu.stanford.nlp.pipeline.StanfordCoreNLP;
import edu.stanford.nlp.util.CoreMap;
import io.nlpbridge.corenlp.config.BridgeConfig;
import io.nlpbridge.corenlp.dto.AnnotatedSentence;
import io.nlpbridge.corenlp.dto.AnnotatedToken;
import io.nlpbridge.corenlp.dto.AnnotationResult;
import io.nlpbridge.corenlp.model.LanguageCode;
import io.nlpbridge.corenlp.model.LanguageRegistry;
import io.nlpbridge.corenlp.service.pipeline.PipelineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class AnnotationService {

    private static final Logger logger = LoggerFactory.getLogger(AnnotationService.class);

    private final PipelineService pipelineService;
    private final LanguageRegistry languageRegistry;
    private final BridgeConfig config;

    public AnnotationService(PipelineService pipelineService, LanguageRegistry languageRegistry, BridgeConfig config) {
        this.pipelineService = pipelineService;
        this.languageRegistry = languageRegistry;
        this.config = config;
    }

    /**
     * Annotate text with a pipeline for the given language and annotators.
     * Null language or annotators fall back to the configured defaults.
     */
    public AnnotationResult annotate(String text, String language, List<String> annotators) {
        LanguageCode languageCode = languageRegistry.resolve(
                language != null ? language : config.models().defaultLanguage());
        List<String> requested = annotators == null || annotators.isEmpty()
                ? config.pipeline().defaultAnnotators()
                : annotators;

        if (text == null || text.trim().isEmpty()) {
            return AnnotationResult.empty(languageCode.getKey(), requested);
        }

        StanfordCoreNLP pipeline = pipelineService.pipelineFor(languageCode.getKey(), requested);

        try {
            long startTime = System.currentTimeMillis();

            Annotation document = new Annotation(text);
            pipeline.annotate(document);

            List<AnnotatedSentence> sentences = extractSentences(document);

            long processingTime = System.currentTimeMillis() - startTime;
            logger.debug("Annotated {} sentences in {}ms", sentences.size(), processingTime);

            return new AnnotationResult(languageCode.getKey(), requested, sentences, processingTime);

        } catch (RuntimeException e) {
            logger.error("Failed to annotate text with [{}]: {}", String.join(", ", requested), e.getMessage(), e);
            throw e;
        }
    }

    private List<AnnotatedSentence> extractSentences(Annotation document) {
        List<CoreMap> sentences = document.get(CoreAnnotations.SentencesAnnotation.class);

        // Without ssplit the whole document is one token sequence
        if (sentences == null) {
            List<CoreLabel> tokens = document.get(CoreAnnotations.TokensAnnotation.class);
            if (tokens == null) {
                return List.of();
            }
            return List.of(new AnnotatedSentence(0, document.get(CoreAnnotations.TextAnnotation.class), toTokens(tokens)));
        }

        List<AnnotatedSentence> result = new ArrayList<>();
        for (int i = 0; i < sentences.size(); i++) {
            CoreMap sentence = sentences.get(i);
            result.add(new AnnotatedSentence(
                    i,
                    sentence.get(CoreAnnotations.TextAnnotation.class),
                    toTokens(sentence.get(CoreAnnotations.TokensAnnotation.class))
            ));
        }
        return result;
    }

    private List<AnnotatedToken> toTokens(List<CoreLabel> labels) {
        if (labels == null) {
            return List.of();
        }

        return labels.stream()
                .map(label -> new AnnotatedToken(
                        label.word(),
                        label.lemma(),
                        label.tag(),
                        label.ner(),
                        label.beginPosition(),
                        label.endPosition()
                ))
                .toList();
    }
}
