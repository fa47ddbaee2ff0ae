package io.nlpbridge.corenlp.api;

import io.nlpbridge.corenlp.dto.LanguageInfo;
import io.nlpbridge.corenlp.model.LanguageProfile;
import io.nlpbridge.corenlp.model.LanguageRegistry;
import io.nlpbridge.corenlp.model.ModelCatalog;
import io.nlpbridge.corenlp.service.pipeline.PipelineService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/languages")
public class LanguageController {

    private final LanguageRegistry languageRegistry;
    private final ModelCatalog modelCatalog;
    private final PipelineService pipelineService;

    public LanguageController(LanguageRegistry languageRegistry, ModelCatalog modelCatalog, PipelineService pipelineService) {
        this.languageRegistry = languageRegistry;
        this.modelCatalog = modelCatalog;
        this.pipelineService = pipelineService;
    }

    @GetMapping
    public ResponseEntity<List<LanguageInfo>> listLanguages() {
        List<LanguageInfo> languages = languageRegistry.supportedLanguages().stream()
                .map(language -> new LanguageInfo(
                        language,
                        language.getCodes(),
                        modelCatalog.availableFamilies(language)))
                .toList();

        return ResponseEntity.ok(languages);
    }

    @GetMapping("/{token}")
    public ResponseEntity<Map<String, Object>> getProfile(@PathVariable String token) {
        LanguageProfile profile = pipelineService.selectLanguage(token);

        return ResponseEntity.ok(Map.of(
                "language", profile.language(),
                "requested", token,
                "modelFiles", profile.flatModelFiles()
        ));
    }
}
