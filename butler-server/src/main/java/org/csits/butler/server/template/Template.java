package org.csits.butler.server.template;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 风格模板，对应 templates.yaml 中的一项。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Template {

    private String id;

    private String name;

    @JsonAlias("preview_url")
    private String previewUrl;

    /**
     * 默认提示词，用户未填写自定义提示词时使用。
     */
    private String prompt;

    private String category;

    public Template copy() {
        return new Template(id, name, previewUrl, prompt, category);
    }
}
