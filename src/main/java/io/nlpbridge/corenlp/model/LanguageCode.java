package io.nlpbridge.corenlp.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical languages with CoreNLP models.
 * <p>
 * Each constant owns the surface tokens it answers to: full English name,
 * ISO-639-1 and the ISO-639-2/3 codes. Token sets never overlap.
 */
public enum LanguageCode {
    ENGLISH("english", List.of("en", "eng")),
    GERMAN("german", List.of("de", "ger", "deu")),
    FRENCH("french", List.of("fr", "fre", "fra")),
    SPANISH("spanish", List.of("es", "spa")),
    ARABIC("arabic", List.of("ar", "ara")),
    CHINESE("chinese", List.of("zh", "ch", "chi", "zho")),
    XINHUA("xinhua", List.of("xi", "xin"));

    private final String key;
    private final List<String> codes;

    LanguageCode(String key, List<String> isoCodes) {
        this.key = key;
        List<String> all = new ArrayList<>(isoCodes);
        all.add(key);
        this.codes = List.copyOf(all);
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    /**
     * All tokens that resolve to this language, canonical key last.
     */
    public List<String> getCodes() {
        return codes;
    }

    public boolean matches(String token) {
        return codes.contains(token);
    }
}
