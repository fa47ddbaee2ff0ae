package io.nlpbridge.corenlp.exception;

import java.nio.file.Path;

/**
 * A model file required by the requested annotators is not readable.
 */
public class ModelNotFoundException extends ModelResolutionException {

    private final Path path;

    public ModelNotFoundException(Path path) {
        super("Model file " + path + " could not be found. " +
                "You may need to download this file manually and/or set the model path properly.");
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
