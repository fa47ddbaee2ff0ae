package io.nlpbridge.corenlp.api;

import io.nlpbridge.corenlp.config.BridgeConfig;
import io.nlpbridge.corenlp.dto.AnnotateRequest;
import io.nlpbridge.corenlp.dto.AnnotationResult;
import io.nlpbridge.corenlp.dto.PipelineRequest;
import io.nlpbridge.corenlp.model.LanguageProfile;
import io.nlpbridge.corenlp.model.ResolvedConfiguration;
import io.nlpbridge.corenlp.service.annotation.AnnotationService;
import io.nlpbridge.corenlp.service.pipeline.PipelineService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineController {

    private final PipelineService pipelineService;
    private final AnnotationService annotationService;
    private final BridgeConfig config;

    public PipelineController(PipelineService pipelineService, AnnotationService annotationService, BridgeConfig config) {
        this.pipelineService = pipelineService;
        this.annotationService = annotationService;
        this.config = config;
    }

    /**
     * Dry run: resolves and validates the configuration a pipeline would be built with.
     */
    @PostMapping("/configuration")
    public ResponseEntity<ResolvedConfiguration> resolveConfiguration(@RequestBody PipelineRequest request) {
        LanguageProfile profile = request.language() != null
                ? pipelineService.selectLanguage(request.language())
                : pipelineService.getDefaultProfile();

        if (request.modelOverrides() != null) {
            for (Map.Entry<String, String> override : request.modelOverrides().entrySet()) {
                profile = pipelineService.setModelOverride(profile, override.getKey(), override.getValue());
            }
        }

        List<String> annotators = request.annotators() != null && !request.annotators().isEmpty()
                ? request.annotators()
                : config.pipeline().defaultAnnotators();

        return ResponseEntity.ok(pipelineService.resolveConfiguration(profile, annotators, request.customProperties()));
    }

    @PostMapping("/annotate")
    public ResponseEntity<AnnotationResult> annotate(@RequestBody AnnotateRequest request) {
        if (request.text() == null || request.text().trim().isEmpty()) {
            return ResponseEntity.badRequest().build();
        }

        return ResponseEntity.ok(annotationService.annotate(request.text(), request.language(), request.annotators()));
    }
}
