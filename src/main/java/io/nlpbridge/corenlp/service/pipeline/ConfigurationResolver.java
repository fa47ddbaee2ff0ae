package io.nlpbridge.corenlp.service.pipeline;

import io.nlpbridge.corenlp.config.BridgeConfig;
import io.nlpbridge.corenlp.exception.AnnotatorUnavailableException;
import io.nlpbridge.corenlp.exception.ModelNotFoundException;
import io.nlpbridge.corenlp.model.AnnotatorFamily;
import io.nlpbridge.corenlp.model.LanguageCode;
import io.nlpbridge.corenlp.model.LanguageProfile;
import io.nlpbridge.corenlp.model.LanguageRegistry;
import io.nlpbridge.corenlp.model.ModelCatalog;
import io.nlpbridge.corenlp.model.ModelEntry;
import io.nlpbridge.corenlp.model.ResolvedConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns a language selection and an annotator list into the property set a CoreNLP pipeline is built from.
 * Stateless: every call works from its arguments and the static catalog.
 */
@Component
public class ConfigurationResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationResolver.class);

    static final String SUTIME_FOLDER = "sutime/";
    static final List<String> SUTIME_RULE_FILES = List.of("defs.sutime.txt", "english.sutime.txt");

    private final LanguageRegistry languageRegistry;
    private final ModelCatalog modelCatalog;
    private final BridgeConfig config;

    public ConfigurationResolver(LanguageRegistry languageRegistry, ModelCatalog modelCatalog, BridgeConfig config) {
        this.languageRegistry = languageRegistry;
        this.modelCatalog = modelCatalog;
        this.config = config;
    }

    /**
     * Resolve a language token and build its model table from scratch.
     */
    public LanguageProfile selectLanguage(String token) {
        LanguageCode language = languageRegistry.resolve(token);

        Map<AnnotatorFamily, Map<String, String>> modelFiles = new EnumMap<>(AnnotatorFamily.class);
        for (AnnotatorFamily family : AnnotatorFamily.values()) {
            List<ModelEntry> entries = modelCatalog.modelsFor(family, language);
            if (entries.isEmpty()) {
                continue;
            }

            Map<String, String> files = new LinkedHashMap<>();
            entries.forEach(entry -> files.put(entry.propertyKey(), entry.relativePath()));
            modelFiles.put(family, files);
        }

        logger.debug("Selected language {} ('{}') with model families {}", language.getKey(), token, modelFiles.keySet());
        return new LanguageProfile(language, modelFiles);
    }

    /**
     * Replace one model file, e.g. {@code ("ner.model.3class", "my.crf.ser.gz")}.
     * The path is relative to the family folder.
     */
    public LanguageProfile withModelOverride(LanguageProfile profile, String propertyKey, String relativePath) {
        if (propertyKey == null || relativePath == null) {
            throw new IllegalArgumentException("Model key and path are required");
        }

        String familyId = propertyKey.split("\\.", 2)[0];
        AnnotatorFamily family = AnnotatorFamily.fromId(familyId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown annotator family '" + familyId + "' in model key " + propertyKey));

        return profile.withModel(family, propertyKey, modelCatalog.folderOf(family) + relativePath);
    }

    /**
     * Build the full property set for the given annotators without constructing a pipeline.
     *
     * @throws AnnotatorUnavailableException if a requested family has no model for the language
     * @throws ModelNotFoundException        on the first model file that is not readable
     */
    public ResolvedConfiguration resolve(LanguageProfile profile, List<String> annotators, Map<String, String> customOverrides) {
        validateAnnotators(annotators);
        validateOverrides(customOverrides);

        Path modelPath = config.models().basePath().toAbsolutePath();
        Map<String, String> properties = new LinkedHashMap<>();

        for (String annotator : annotators) {
            Optional<AnnotatorFamily> family = AnnotatorFamily.fromId(annotator);
            if (family.isEmpty()) {
                continue;
            }
            if (!profile.hasModels(family.get())) {
                throw new AnnotatorUnavailableException(family.get(), profile.language());
            }

            for (Map.Entry<String, String> model : profile.modelsOf(family.get()).entrySet()) {
                Path file = modelPath.resolve(model.getValue());
                if (!Files.isReadable(file)) {
                    throw new ModelNotFoundException(file);
                }
                logger.debug("Using {} = {}", model.getKey(), file);
                properties.put(model.getKey(), file.toString());
            }
        }

        properties.put("annotators", String.join(", ", annotators));

        if (!profile.isEnglish()) {
            // Non-English grammars reject -retainTmpSubcategories and fail while building graphs
            properties.put("parse.flags", "");
            properties.put("parse.buildgraphs", "false");
        }

        // SUTime fails to initialize its binders otherwise
        properties.put("sutime.binders", "0");

        if (annotators.contains(AnnotatorFamily.NER.getId())) {
            properties.put("sutime.rules", sutimeRules(modelPath));
        }

        properties.putAll(config.pipeline().customProperties());
        if (customOverrides != null) {
            properties.putAll(customOverrides);
        }

        return new ResolvedConfiguration(profile.language(), annotators, properties);
    }

    private static String sutimeRules(Path modelPath) {
        return SUTIME_RULE_FILES.stream()
                .map(file -> modelPath.resolve(SUTIME_FOLDER + file).toString())
                .collect(Collectors.joining(", "));
    }

    private static void validateOverrides(Map<String, String> customOverrides) {
        if (customOverrides == null) {
            return;
        }
        customOverrides.forEach((key, value) -> {
            if (key == null || value == null) {
                throw new IllegalArgumentException("Custom property " + key + " has no value");
            }
        });
    }

    private static void validateAnnotators(List<String> annotators) {
        if (annotators == null || annotators.isEmpty()) {
            throw new IllegalArgumentException("At least one annotator is required");
        }
        if (annotators.stream().anyMatch(annotator -> annotator == null || annotator.isBlank())) {
            throw new IllegalArgumentException("Annotator names must not be blank: " + annotators);
        }
    }
}
