package org.csits.butler.manager.storage;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个存储目录的文件数与占用字节数。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StorageStatistics {

    private long files;

    private long sizeBytes;
}
