package org.csits.butler.server.template;

import java.util.List;
import java.util.Optional;

/**
 * 模板目录，只读。
 */
public interface TemplateCatalog {

    Optional<Template> getTemplateById(String id);

    List<Template> listTemplates();
}
