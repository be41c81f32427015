package org.csits.butler.server.exception;

/**
 * 模板不存在。创建任务时抛出，任务不会被创建。
 */
public class TemplateNotFoundException extends RuntimeException {

    private final String templateId;

    public TemplateNotFoundException(String templateId) {
        super("Template not found: " + templateId);
        this.templateId = templateId;
    }

    public String getTemplateId() {
        return templateId;
    }
}
