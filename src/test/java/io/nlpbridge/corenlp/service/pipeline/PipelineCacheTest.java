package io.nlpbridge.corenlp.service.pipeline;

import edu.stanford.nlp.pipeline.StanfordCoreNLP;
import io.nlpbridge.corenlp.config.CacheConfig;
import io.nlpbridge.corenlp.exception.ModelNotFoundException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.cache.CacheManager;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@SpringBootTest
class PipelineCacheTest {

    private static final Path MODEL_PATH = createModelPath();
    private static final Path TAGGER = MODEL_PATH.resolve("taggers/english-left3words-distsim.tagger");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("bridge.models.path", MODEL_PATH::toString);
        registry.add("bridge.pipeline.enable-cache", () -> "true");
        registry.add("bridge.logging.quiet", () -> "true");
    }

    @MockBean
    private PipelineGateway gateway;

    @Autowired
    private PipelineService pipelineService;

    @Autowired
    private CacheManager cacheManager;

    @BeforeEach
    void setUp() throws IOException {
        cacheManager.getCache(CacheConfig.PIPELINES_CACHE).clear();
        Files.deleteIfExists(TAGGER);
        when(gateway.createPipeline(any())).thenAnswer(invocation -> mock(StanfordCoreNLP.class));
    }

    @AfterAll
    static void cleanUp() throws IOException {
        FileSystemUtils.deleteRecursively(MODEL_PATH);
    }

    @Test
    @DisplayName("Should build a pipeline once for repeated requests of the same language and annotators")
    void shouldReuseCachedPipeline() {
        StanfordCoreNLP first = pipelineService.pipelineFor("english", List.of("tokenize"));
        StanfordCoreNLP second = pipelineService.pipelineFor("english", List.of("tokenize"));

        assertThat(second).isSameAs(first);
        verify(gateway, times(1)).createPipeline(any());
    }

    @Test
    @DisplayName("Should build separate pipelines for different annotator lists")
    void shouldKeyCacheByAnnotators() {
        pipelineService.pipelineFor("english", List.of("tokenize"));
        pipelineService.pipelineFor("english", List.of("tokenize", "ssplit"));

        verify(gateway, times(2)).createPipeline(any());
    }

    @Test
    @DisplayName("Should not cache a failed load and build the pipeline once the model appears")
    void shouldNotCacheFailedLoad() throws IOException {
        assertThatThrownBy(() -> pipelineService.pipelineFor("english", List.of("tokenize", "pos")))
                .isInstanceOf(ModelNotFoundException.class);
        verify(gateway, never()).createPipeline(any());

        Files.createDirectories(TAGGER.getParent());
        Files.writeString(TAGGER, "model");

        StanfordCoreNLP pipeline = pipelineService.pipelineFor("english", List.of("tokenize", "pos"));

        assertThat(pipeline).isNotNull();
        verify(gateway, times(1)).createPipeline(any());
    }

    private static Path createModelPath() {
        try {
            return Files.createTempDirectory("corenlp-models");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
