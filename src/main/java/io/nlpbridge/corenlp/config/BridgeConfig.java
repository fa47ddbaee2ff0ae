package io.nlpbridge.corenlp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "bridge")
public record BridgeConfig(
        Models models,
        Pipeline pipeline,
        Logging logging
) {
    public BridgeConfig {
        models = models != null ? models : new Models(null, null);
        pipeline = pipeline != null ? pipeline : new Pipeline(null, null, true);
        logging = logging != null ? logging : new Logging(false);
    }

    public record Models(
            String path,        // folder holding taggers/, classifiers/, grammar/, ...
            String defaultLanguage
    ) {
        public Models {
            path = path != null ? path : "./models/";
            defaultLanguage = defaultLanguage != null ? defaultLanguage : "english";
        }

        public Path basePath() {
            return Path.of(path);
        }
    }

    public record Pipeline(
            List<String> defaultAnnotators,
            Map<String, String> customProperties,
            boolean enableCache
    ) {
        public Pipeline {
            defaultAnnotators = defaultAnnotators != null
                    ? List.copyOf(defaultAnnotators)
                    : List.of("tokenize", "ssplit", "pos");
            customProperties = customProperties != null ? Map.copyOf(customProperties) : Map.of();
        }
    }

    public record Logging(
            boolean quiet // silence CoreNLP's own Redwood logging
    ) {}
}
