package io.nlpbridge.corenlp.service.pipeline;

import edu.stanford.nlp.util.logging.RedwoodConfiguration;
import edu.stanford.nlp.util.logging.StanfordRedwoodConfiguration;
import io.nlpbridge.corenlp.config.BridgeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * One-time preparation of the CoreNLP engine before the first pipeline is loaded.
 */
@Component
public class BridgeBootstrap {

    private static final Logger logger = LoggerFactory.getLogger(BridgeBootstrap.class);

    private final BridgeConfig config;
    private boolean initialized = false;

    public BridgeBootstrap(BridgeConfig config) {
        this.config = config;
    }

    public synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }

        logger.info("Initializing CoreNLP bridge...");

        if (config.logging().quiet()) {
            // drops every Redwood handler, CoreNLP stays silent
            RedwoodConfiguration.current().clear().apply();
        } else {
            StanfordRedwoodConfiguration.minimalSetup();
        }

        Path modelPath = config.models().basePath().toAbsolutePath();
        if (isModelPathAvailable()) {
            logger.info("CoreNLP bridge initialized, models under {}", modelPath);
        } else {
            logger.warn("Model path {} does not exist; pipelines needing model files will fail to load", modelPath);
        }

        initialized = true;
    }

    public synchronized boolean isInitialized() {
        return initialized;
    }

    public boolean isModelPathAvailable() {
        return Files.isDirectory(config.models().basePath());
    }
}
