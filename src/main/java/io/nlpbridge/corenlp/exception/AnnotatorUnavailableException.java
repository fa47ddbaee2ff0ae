package io.nlpbridge.corenlp.exception;

import io.nlpbridge.corenlp.model.AnnotatorFamily;
import io.nlpbridge.corenlp.model.LanguageCode;

public class AnnotatorUnavailableException extends ModelResolutionException {

    private final AnnotatorFamily family;
    private final LanguageCode language;

    public AnnotatorUnavailableException(AnnotatorFamily family, LanguageCode language) {
        super("Annotator '" + family.getId() + "' has no model for language '" + language.getKey() + "'");
        this.family = family;
        this.language = language;
    }

    public AnnotatorFamily getFamily() {
        return family;
    }

    public LanguageCode getLanguage() {
        return language;
    }
}
