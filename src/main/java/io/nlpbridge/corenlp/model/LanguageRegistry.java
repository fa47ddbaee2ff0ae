package io.nlpbridge.corenlp.model;

import io.nlpbridge.corenlp.exception.UnresolvedLanguageException;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps a language name or ISO-639 code to its {@link LanguageCode}.
 */
@Component
public class LanguageRegistry {

    public LanguageCode resolve(String token) {
        return find(token).orElseThrow(() -> new UnresolvedLanguageException(token));
    }

    /**
     * First language whose code set contains the token (case-insensitive, trimmed).
     */
    public Optional<LanguageCode> find(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }

        String normalized = token.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(LanguageCode.values())
                .filter(language -> language.matches(normalized))
                .findFirst();
    }

    public List<LanguageCode> supportedLanguages() {
        return List.of(LanguageCode.values());
    }
}
