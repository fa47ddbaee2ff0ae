package io.nlpbridge.corenlp.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A selected language together with the model files resolved for it.
 * <p>
 * Immutable; overriding a model yields a new profile.
 *
 * @param modelFiles per family, property key to path relative to the model path
 */
public record LanguageProfile(
        LanguageCode language,
        Map<AnnotatorFamily, Map<String, String>> modelFiles
) {
    public LanguageProfile {
        Map<AnnotatorFamily, Map<String, String>> copy = new EnumMap<>(AnnotatorFamily.class);
        modelFiles.forEach((family, files) ->
                copy.put(family, Collections.unmodifiableMap(new LinkedHashMap<>(files))));
        modelFiles = Collections.unmodifiableMap(copy);
    }

    public boolean isEnglish() {
        return language == LanguageCode.ENGLISH;
    }

    public Map<String, String> modelsOf(AnnotatorFamily family) {
        return modelFiles.getOrDefault(family, Map.of());
    }

    public boolean hasModels(AnnotatorFamily family) {
        return !modelsOf(family).isEmpty();
    }

    /**
     * All model files flattened into one property-key to relative-path map.
     */
    public Map<String, String> flatModelFiles() {
        Map<String, String> flat = new LinkedHashMap<>();
        modelFiles.values().forEach(flat::putAll);
        return flat;
    }

    /**
     * Copy of this profile with a single model path replaced or added.
     */
    public LanguageProfile withModel(AnnotatorFamily family, String propertyKey, String relativePath) {
        Map<AnnotatorFamily, Map<String, String>> updated = new EnumMap<>(AnnotatorFamily.class);
        updated.putAll(modelFiles);

        Map<String, String> familyFiles = new LinkedHashMap<>(modelsOf(family));
        familyFiles.put(propertyKey, relativePath);
        updated.put(family, familyFiles);

        return new LanguageProfile(language, updated);
    }
}
