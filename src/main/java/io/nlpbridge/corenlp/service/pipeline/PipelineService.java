package io.nlpbridge.corenlp.service.pipeline;

import edu.stanford.nlp.pipeline.StanfordCoreNLP;
import io.nlpbridge.corenlp.config.BridgeConfig;
import io.nlpbridge.corenlp.model.LanguageProfile;
import io.nlpbridge.corenlp.model.ResolvedConfiguration;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Entry point for choosing a language and loading CoreNLP pipelines for it.
 */
@Service
public class PipelineService {

    private static final Logger logger = LoggerFactory.getLogger(PipelineService.class);

    private final ConfigurationResolver resolver;
    private final PipelineGateway gateway;
    private final BridgeBootstrap bootstrap;
    private final BridgeConfig config;
    private LanguageProfile defaultProfile;

    public PipelineService(ConfigurationResolver resolver,
                           PipelineGateway gateway,
                           BridgeBootstrap bootstrap,
                           BridgeConfig config) {
        this.resolver = resolver;
        this.gateway = gateway;
        this.bootstrap = bootstrap;
        this.config = config;
    }

    @PostConstruct
    public void selectDefaultLanguage() {
        defaultProfile = resolver.selectLanguage(config.models().defaultLanguage());
        logger.info("Default language set to {}", defaultProfile.language().getKey());
    }

    public LanguageProfile getDefaultProfile() {
        return defaultProfile;
    }

    public LanguageProfile selectLanguage(String language) {
        LanguageProfile profile = resolver.selectLanguage(language);
        logger.info("Using models for {}", profile.language().getKey());
        return profile;
    }

    public LanguageProfile setModelOverride(LanguageProfile profile, String propertyKey, String relativePath) {
        logger.info("Overriding model {} with {}", propertyKey, relativePath);
        return resolver.withModelOverride(profile, propertyKey, relativePath);
    }

    /**
     * Resolve the configuration without building a pipeline.
     */
    public ResolvedConfiguration resolveConfiguration(LanguageProfile profile,
                                                      List<String> annotators,
                                                      Map<String, String> customOverrides) {
        return resolver.resolve(profile, annotators, customOverrides);
    }

    /**
     * Load a pipeline for the profile. Nothing is constructed if any model file is missing,
     * and engine failures reach the caller as thrown.
     */
    public StanfordCoreNLP loadPipeline(LanguageProfile profile,
                                        List<String> annotators,
                                        Map<String, String> customOverrides) {
        bootstrap.ensureInitialized();

        ResolvedConfiguration configuration = resolver.resolve(profile, annotators, customOverrides);

        logger.info("Loading {} pipeline with annotators: {}",
                configuration.language().getKey(), configuration.get("annotators"));
        logger.debug("Pipeline properties: {}", configuration.properties());

        return gateway.createPipeline(configuration.toProperties());
    }

    public StanfordCoreNLP loadPipeline(List<String> annotators) {
        return loadPipeline(defaultProfile, annotators, Map.of());
    }

    /**
     * Pipeline for a canonical language key, cached when caching is enabled. Failed loads are not cached.
     */
    @Cacheable(cacheResolver = "pipelineCacheResolver", key = "#language + ':' + #annotators")
    public StanfordCoreNLP pipelineFor(String language, List<String> annotators) {
        return loadPipeline(selectLanguage(language), annotators, Map.of());
    }
}
