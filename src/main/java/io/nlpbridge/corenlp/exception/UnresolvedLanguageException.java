package io.nlpbridge.corenlp.exception;

public class UnresolvedLanguageException extends ModelResolutionException {

    private final String token;

    public UnresolvedLanguageException(String token) {
        super("Unknown language '" + token + "'. Use a full name or an ISO-639 code (e.g. english, eng, en).");
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
