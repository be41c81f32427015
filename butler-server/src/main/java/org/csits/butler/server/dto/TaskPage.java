package org.csits.butler.server.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 任务分页结果，page 从 1 开始。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskPage {

    private List<GenerationTaskView> tasks;

    private long total;

    private int page;

    private int limit;
}
