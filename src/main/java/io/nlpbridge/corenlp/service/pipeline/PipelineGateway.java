package io.nlpbridge.corenlp.service.pipeline;

import edu.stanford.nlp.pipeline.StanfordCoreNLP;

import java.util.Properties;

/**
 * Builds a CoreNLP pipeline from a resolved configuration.
 * Implementations must let the engine's own exceptions through unchanged.
 */
public interface PipelineGateway {

    StanfordCoreNLP createPipeline(Properties properties);
}
