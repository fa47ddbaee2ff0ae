package io.nlpbridge.corenlp.exception;

/**
 * Base type for failures while turning a language and annotator list into a pipeline configuration.
 */
public class ModelResolutionException extends RuntimeException {

    public ModelResolutionException(String message) {
        super(message);
    }
}
