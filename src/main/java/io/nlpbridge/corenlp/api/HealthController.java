package io.nlpbridge.corenlp.api;

import io.nlpbridge.corenlp.config.BridgeConfig;
import io.nlpbridge.corenlp.service.pipeline.BridgeBootstrap;
import io.nlpbridge.corenlp.service.pipeline.PipelineService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/bridge")
public class HealthController {

    @Value("${spring.application.name}")
    private String serviceName;

    private final BridgeBootstrap bootstrap;
    private final PipelineService pipelineService;
    private final BridgeConfig config;

    public HealthController(BridgeBootstrap bootstrap, PipelineService pipelineService, BridgeConfig config) {
        this.bootstrap = bootstrap;
        this.pipelineService = pipelineService;
        this.config = config;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean modelsAvailable = bootstrap.isModelPathAvailable();

        Map<String, Object> healthInfo = Map.of(
                "status", modelsAvailable ? "UP" : "DOWN",
                "service", serviceName,
                "timestamp", LocalDateTime.now(),
                "bridge", Map.of(
                        "initialized", bootstrap.isInitialized(),
                        "modelPath", config.models().basePath().toAbsolutePath().toString(),
                        "modelPathAvailable", modelsAvailable,
                        "defaultLanguage", pipelineService.getDefaultProfile().language().getKey(),
                        "pipelineCache", config.pipeline().enableCache()
                )
        );

        return modelsAvailable ?
                ResponseEntity.ok(healthInfo) :
                ResponseEntity.status(503).body(healthInfo);
    }
}
