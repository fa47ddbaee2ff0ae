package io.nlpbridge.corenlp.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Flat property mapping handed to the CoreNLP engine, in the order the properties were set.
 */
public record ResolvedConfiguration(
        @JsonProperty("language") LanguageCode language,
        @JsonProperty("annotators") List<String> annotators,
        @JsonProperty("properties") Map<String, String> properties
) {
    public ResolvedConfiguration {
        annotators = List.copyOf(annotators);
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public String get(String key) {
        return properties.get(key);
    }

    public boolean contains(String key) {
        return properties.containsKey(key);
    }

    @JsonIgnore
    public Properties toProperties() {
        Properties props = new Properties();
        properties.forEach(props::setProperty);
        return props;
    }
}
