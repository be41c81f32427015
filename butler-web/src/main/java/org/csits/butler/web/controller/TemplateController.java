package org.csits.butler.web.controller;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.csits.butler.server.exception.TemplateNotFoundException;
import org.csits.butler.server.template.Template;
import org.csits.butler.server.template.TemplateCatalog;
import org.csits.butler.web.dto.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 模板查询接口
 */
@RestController
@RequestMapping("/api/templates")
@RequiredArgsConstructor
public class TemplateController {

    private final TemplateCatalog templateCatalog;

    @GetMapping
    public ResponseEntity<ApiResponse<List<Template>>> listTemplates() {
        return ResponseEntity.ok(ApiResponse.ok(templateCatalog.listTemplates()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<Template>> getTemplate(@PathVariable String id) {
        Template template = templateCatalog.getTemplateById(id)
            .orElseThrow(() -> new TemplateNotFoundException(id));
        return ResponseEntity.ok(ApiResponse.ok(template));
    }
}
