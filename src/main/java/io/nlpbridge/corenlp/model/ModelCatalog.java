package io.nlpbridge.corenlp.model;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.nlpbridge.corenlp.model.LanguageCode.*;

/**
 * Built-in table of CoreNLP model files per annotator family and language.
 * <p>
 * A family either has one model per language (property {@code family.model}) or a set of
 * named sub-models (property {@code family.<name>}, e.g. {@code ner.model.3class}).
 * Paths are relative to the family folder; {@link #modelsFor} returns them with the folder prepended.
 */
@Component
public class ModelCatalog {

    private static final Map<AnnotatorFamily, Map<LanguageCode, ModelSet>> MODELS = buildCatalog();

    /**
     * Model entries of a family for a language, in declaration order. Empty if the language has none.
     */
    public List<ModelEntry> modelsFor(AnnotatorFamily family, LanguageCode language) {
        ModelSet models = MODELS.getOrDefault(family, Map.of()).get(language);
        if (models == null) {
            return List.of();
        }

        List<ModelEntry> entries = new ArrayList<>();
        models.files().forEach((name, file) -> entries.add(
                new ModelEntry(family, family.getId() + "." + name, family.getFolder() + file)));
        return Collections.unmodifiableList(entries);
    }

    public String folderOf(AnnotatorFamily family) {
        return family.getFolder();
    }

    public boolean isAvailable(AnnotatorFamily family, LanguageCode language) {
        return MODELS.getOrDefault(family, Map.of()).containsKey(language);
    }

    public List<AnnotatorFamily> availableFamilies(LanguageCode language) {
        return Arrays.stream(AnnotatorFamily.values())
                .filter(family -> isAvailable(family, language))
                .toList();
    }

    /**
     * Files of one (family, language) pair. Single-model families store their file under "model".
     */
    private record ModelSet(Map<String, String> files) {

        static ModelSet single(String file) {
            return new ModelSet(Map.of("model", file));
        }

        static ModelSet named(String... nameFilePairs) {
            Map<String, String> files = new LinkedHashMap<>();
            for (int i = 0; i < nameFilePairs.length; i += 2) {
                files.put(nameFilePairs[i], nameFilePairs[i + 1]);
            }
            return new ModelSet(Collections.unmodifiableMap(files));
        }
    }

    private static Map<AnnotatorFamily, Map<LanguageCode, ModelSet>> buildCatalog() {
        Map<AnnotatorFamily, Map<LanguageCode, ModelSet>> catalog = new EnumMap<>(AnnotatorFamily.class);

        catalog.put(AnnotatorFamily.POS, languages(Map.of(
                ENGLISH, ModelSet.single("english-left3words-distsim.tagger"),
                GERMAN, ModelSet.single("german-fast.tagger"),
                FRENCH, ModelSet.single("french.tagger"),
                SPANISH, ModelSet.single("spanish-distsim.tagger"),
                ARABIC, ModelSet.single("arabic.tagger"),
                CHINESE, ModelSet.single("chinese-distsim.tagger"))
        ));

        catalog.put(AnnotatorFamily.NER, languages(Map.of(
                ENGLISH, ModelSet.named(
                        "model.3class", "english.all.3class.distsim.crf.ser.gz",
                        "model.7class", "english.muc.7class.distsim.crf.ser.gz",
                        "model.MISCclass", "english.conll.4class.distsim.crf.ser.gz"),
                GERMAN, ModelSet.single("german.conll.germeval2014.hgc_175m_600.crf.ser.gz"),
                SPANISH, ModelSet.single("spanish.ancora.distsim.s512.crf.ser.gz"),
                CHINESE, ModelSet.single("chinese.misc.distsim.crf.ser.gz"))
        ));

        catalog.put(AnnotatorFamily.PARSE, languages(Map.of(
                ENGLISH, ModelSet.single("englishPCFG.ser.gz"),
                GERMAN, ModelSet.single("germanPCFG.ser.gz"),
                FRENCH, ModelSet.single("frenchFactored.ser.gz"),
                SPANISH, ModelSet.single("spanishPCFG.ser.gz"),
                ARABIC, ModelSet.single("arabicFactored.ser.gz"),
                CHINESE, ModelSet.single("chinesePCFG.ser.gz"),
                XINHUA, ModelSet.single("xinhuaPCFG.ser.gz"))
        ));

        catalog.put(AnnotatorFamily.DEPPARSE, languages(Map.of(
                ENGLISH, ModelSet.single("english_UD.gz"),
                CHINESE, ModelSet.single("PTB_CoNLL_params.txt.gz"))
        ));

        catalog.put(AnnotatorFamily.DCOREF, languages(Map.of(
                ENGLISH, ModelSet.named(
                        "demonym", "demonyms.txt",
                        "animate", "animate.unigrams.txt",
                        "female", "female.unigrams.txt",
                        "inanimate", "inanimate.unigrams.txt",
                        "male", "male.unigrams.txt",
                        "neutral", "neutral.unigrams.txt",
                        "plural", "plural.unigrams.txt",
                        "singular", "singular.unigrams.txt",
                        "states", "state-abbreviations.txt",
                        "extra.gender", "namegender.combine.txt"))
        ));

        catalog.put(AnnotatorFamily.SENTIMENT, languages(Map.of(
                ENGLISH, ModelSet.single("sentiment.ser.gz"))
        ));

        return Collections.unmodifiableMap(catalog);
    }

    private static Map<LanguageCode, ModelSet> languages(Map<LanguageCode, ModelSet> models) {
        return Collections.unmodifiableMap(new EnumMap<>(models));
    }
}
