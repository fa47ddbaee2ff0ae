package io.nlpbridge.corenlp.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Pipeline stages that read model files, with the folder their models live in under the model path.
 * Annotators such as tokenize or ssplit need no model files and are not listed here.
 */
public enum AnnotatorFamily {
    POS("pos", "taggers/"),
    NER("ner", "classifiers/"),
    PARSE("parse", "grammar/"),
    DEPPARSE("depparse", "parser/nndep/"),
    DCOREF("dcoref", "dcoref/"),
    SENTIMENT("sentiment", "sentiment/");

    private final String id;
    private final String folder;

    AnnotatorFamily(String id, String folder) {
        this.id = id;
        this.folder = folder;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getFolder() {
        return folder;
    }

    /**
     * Exact, case-sensitive lookup by annotator name.
     */
    public static Optional<AnnotatorFamily> fromId(String id) {
        return Arrays.stream(values())
                .filter(family -> family.id.equals(id))
                .findFirst();
    }
}
