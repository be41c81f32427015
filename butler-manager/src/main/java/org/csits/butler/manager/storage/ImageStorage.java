package org.csits.butler.manager.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 图片文件存储抽象。原图与生成图均按任务 ID 派生文件名。
 */
public interface ImageStorage {

    Path uploadPath(String name);

    Path generatedPath(String name);

    /**
     * 原图文件名：{taskId}_original{.ext}，扩展名取自客户端文件名，缺省 .jpg
     */
    String originalName(String taskId, String clientFilename);

    /**
     * 生成图文件名：{taskId}_generated.jpg
     */
    String generatedName(String taskId);

    String uploadRef(String name);

    /**
     * 从原图引用中取出文件名，引用不是本地原图时返回空
     */
    Optional<String> uploadName(String ref);

    String generatedRef(String name);

    /**
     * 将本地引用解析为文件路径；远端 URL 或越界引用返回空
     */
    Optional<Path> resolveRef(String ref);

    Path writeUpload(String name, byte[] bytes) throws IOException;

    byte[] readUpload(String name) throws IOException;

    Path writeGenerated(String name, byte[] bytes) throws IOException;

    Path copyToGenerated(Path source, String name) throws IOException;

    /**
     * 列出原图目录下指定扩展名的文件，按文件名排序
     */
    List<Path> listUploads(String... extensions) throws IOException;

    /**
     * 按引用删除本地文件，文件不存在或引用非本地时返回 false
     */
    boolean delete(String ref) throws IOException;

    /**
     * 清理临时目录中超过 maxAge 的文件，返回删除数量
     */
    int cleanupTemp(Duration maxAge) throws IOException;

    Map<String, StorageStatistics> statistics();
}
