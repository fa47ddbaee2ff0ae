package io.nlpbridge.corenlp.model;

/**
 * One model file of a family, keyed by the CoreNLP property it feeds.
 *
 * @param propertyKey  e.g. {@code pos.model} or {@code ner.model.3class}
 * @param relativePath path below the model path, folder included
 */
public record ModelEntry(
        AnnotatorFamily family,
        String propertyKey,
        String relativePath
) {}
