package io.nlpbridge.corenlp.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class LanguageProfileTest {

    @Test
    @DisplayName("Should not be affected by later changes to the source map")
    void shouldCopyModelFiles() {
        Map<String, String> posFiles = new HashMap<>(Map.of("pos.model", "taggers/french.tagger"));
        Map<AnnotatorFamily, Map<String, String>> files = new HashMap<>(Map.of(AnnotatorFamily.POS, posFiles));

        LanguageProfile profile = new LanguageProfile(LanguageCode.FRENCH, files);
        posFiles.put("pos.model", "taggers/other.tagger");
        files.remove(AnnotatorFamily.POS);

        assertThat(profile.modelsOf(AnnotatorFamily.POS)).containsEntry("pos.model", "taggers/french.tagger");
        assertThatThrownBy(() -> profile.modelFiles().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should add a model for a family the profile had none for")
    void shouldAddModelForNewFamily() {
        LanguageProfile profile = new LanguageProfile(LanguageCode.ARABIC, Map.of());

        LanguageProfile updated = profile.withModel(AnnotatorFamily.NER, "ner.model", "classifiers/arabic.crf.ser.gz");

        assertThat(profile.hasModels(AnnotatorFamily.NER)).isFalse();
        assertThat(updated.hasModels(AnnotatorFamily.NER)).isTrue();
        assertThat(updated.flatModelFiles()).containsExactly(entry("ner.model", "classifiers/arabic.crf.ser.gz"));
        assertThat(updated.isEnglish()).isFalse();
    }
}
