package org.csits.butler.server.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.csits.butler.dao.GenerationTaskEntity;
import org.csits.butler.server.template.Template;

/**
 * 任务读视图：任务快照 + 模板信息。模板只在读取时关联，不写回任务。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GenerationTaskView {

    @JsonUnwrapped
    private GenerationTaskEntity task;

    /**
     * 模板已被移除时为 null
     */
    private Template template;
}
