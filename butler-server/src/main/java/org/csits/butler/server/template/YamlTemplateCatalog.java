package org.csits.butler.server.template;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * 使用 Jackson YAML 从 templates.yaml 加载模板目录。文件缺失或格式错误时目录为空。
 */
@Slf4j
@Component
public class YamlTemplateCatalog implements TemplateCatalog {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private final ResourceLoader resourceLoader;

    private final String location;

    private volatile Map<String, Template> templates = Collections.emptyMap();

    public YamlTemplateCatalog(ResourceLoader resourceLoader,
                               @Value("${butler.templates.location:classpath:templates.yaml}") String location) {
        this.resourceLoader = resourceLoader;
        this.location = location;
        reload();
    }

    /**
     * 重新读取模板文件
     */
    public void reload() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("模板文件不存在: {}", location);
            templates = Collections.emptyMap();
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            TemplateFile file = yamlMapper.readValue(in, TemplateFile.class);
            Map<String, Template> loaded = new LinkedHashMap<>();
            if (file != null && file.getTemplates() != null) {
                for (Template template : file.getTemplates()) {
                    if (template.getId() == null || template.getId().trim().isEmpty()) {
                        log.warn("跳过缺少 id 的模板: name={}", template.getName());
                        continue;
                    }
                    if (template.getPrompt() == null) {
                        template.setPrompt("");
                    }
                    loaded.put(template.getId(), template);
                }
            }
            templates = Collections.unmodifiableMap(loaded);
            log.info("加载模板 {} 个: {}", loaded.size(), location);
        } catch (IOException e) {
            log.error("读取模板文件失败: {}", location, e);
            templates = Collections.emptyMap();
        }
    }

    @Override
    public Optional<Template> getTemplateById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(templates.get(id)).map(Template::copy);
    }

    @Override
    public List<Template> listTemplates() {
        return templates.values().stream().map(Template::copy).collect(Collectors.toList());
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TemplateFile {

        private List<Template> templates;
    }
}
