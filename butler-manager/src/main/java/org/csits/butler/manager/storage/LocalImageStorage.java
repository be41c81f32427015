package org.csits.butler.manager.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 本地文件系统实现。目录结构：
 * <pre>
 * {baseDir}/uploads/originals  用户上传的原图
 * {baseDir}/uploads/generated  生成结果
 * {baseDir}/uploads/temp       临时文件
 * </pre>
 */
@Slf4j
@Component
public class LocalImageStorage implements ImageStorage {

    static final String UPLOADS_DIR = "uploads/originals";
    static final String GENERATED_DIR = "uploads/generated";
    static final String TEMP_DIR = "uploads/temp";

    private static final Pattern EXTENSION_PATTERN = Pattern.compile("\\.[a-z0-9]{1,5}");
    private static final String DEFAULT_EXTENSION = ".jpg";

    private final Path baseDir;

    public LocalImageStorage(@Value("${butler.storage.base-dir:.}") String baseDir) {
        this.baseDir = Paths.get(baseDir).toAbsolutePath().normalize();
    }

    @Override
    public Path uploadPath(String name) {
        return baseDir.resolve(UPLOADS_DIR).resolve(checkName(name));
    }

    @Override
    public Path generatedPath(String name) {
        return baseDir.resolve(GENERATED_DIR).resolve(checkName(name));
    }

    @Override
    public String originalName(String taskId, String clientFilename) {
        return taskId + "_original" + extensionOf(clientFilename);
    }

    @Override
    public String generatedName(String taskId) {
        return taskId + "_generated.jpg";
    }

    @Override
    public String uploadRef(String name) {
        return "/" + UPLOADS_DIR + "/" + checkName(name);
    }

    @Override
    public Optional<String> uploadName(String ref) {
        String prefix = "/" + UPLOADS_DIR + "/";
        if (ref == null || !ref.startsWith(prefix)) {
            return Optional.empty();
        }
        String name = ref.substring(prefix.length());
        if (name.isEmpty() || name.contains("/") || name.contains("\\") || name.contains("..")) {
            log.warn("拒绝非法的原图引用: {}", ref);
            return Optional.empty();
        }
        return Optional.of(name);
    }

    @Override
    public String generatedRef(String name) {
        return "/" + GENERATED_DIR + "/" + checkName(name);
    }

    @Override
    public Optional<Path> resolveRef(String ref) {
        if (ref == null || !ref.startsWith("/uploads/")) {
            return Optional.empty();
        }
        Path resolved = baseDir.resolve(ref.substring(1)).normalize();
        if (!resolved.startsWith(baseDir.resolve("uploads"))) {
            log.warn("拒绝越界的文件引用: {}", ref);
            return Optional.empty();
        }
        return Optional.of(resolved);
    }

    @Override
    public Path writeUpload(String name, byte[] bytes) throws IOException {
        return write(uploadPath(name), bytes);
    }

    @Override
    public byte[] readUpload(String name) throws IOException {
        return Files.readAllBytes(uploadPath(name));
    }

    @Override
    public Path writeGenerated(String name, byte[] bytes) throws IOException {
        return write(generatedPath(name), bytes);
    }

    @Override
    public Path copyToGenerated(Path source, String name) throws IOException {
        Path target = generatedPath(name);
        ensureDirectory(target.getParent());
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }

    @Override
    public List<Path> listUploads(String... extensions) throws IOException {
        Path root = baseDir.resolve(UPLOADS_DIR);
        if (Files.notExists(root)) {
            return new ArrayList<>();
        }
        List<String> accepted = Arrays.stream(extensions)
            .map(e -> e.toLowerCase(Locale.ROOT))
            .collect(Collectors.toList());
        try (Stream<Path> stream = Files.list(root)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(p -> accepted.isEmpty() || accepted.stream()
                    .anyMatch(ext -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(ext)))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    @Override
    public boolean delete(String ref) throws IOException {
        Optional<Path> path = resolveRef(ref);
        if (path.isEmpty()) {
            return false;
        }
        boolean deleted = Files.deleteIfExists(path.get());
        if (deleted) {
            log.debug("删除文件: {}", path.get());
        }
        return deleted;
    }

    @Override
    public int cleanupTemp(Duration maxAge) throws IOException {
        Path tempDir = baseDir.resolve(TEMP_DIR);
        if (Files.notExists(tempDir)) {
            return 0;
        }
        Instant threshold = Instant.now().minus(maxAge);
        int deleted = 0;
        try (Stream<Path> stream = Files.list(tempDir)) {
            for (Path file : stream.filter(Files::isRegularFile).collect(Collectors.toList())) {
                FileTime modified = Files.getLastModifiedTime(file);
                if (modified.toInstant().isBefore(threshold) && Files.deleteIfExists(file)) {
                    deleted++;
                }
            }
        }
        log.info("清理临时文件 {} 个", deleted);
        return deleted;
    }

    @Override
    public Map<String, StorageStatistics> statistics() {
        Map<String, StorageStatistics> stats = new LinkedHashMap<>();
        stats.put("uploads", directoryStatistics(baseDir.resolve(UPLOADS_DIR)));
        stats.put("generated", directoryStatistics(baseDir.resolve(GENERATED_DIR)));
        stats.put("temp", directoryStatistics(baseDir.resolve(TEMP_DIR)));
        return stats;
    }

    private StorageStatistics directoryStatistics(Path dir) {
        if (Files.notExists(dir)) {
            return new StorageStatistics(0, 0);
        }
        try (Stream<Path> stream = Files.list(dir)) {
            long files = 0;
            long size = 0;
            for (Path file : stream.filter(Files::isRegularFile).collect(Collectors.toList())) {
                files++;
                size += Files.size(file);
            }
            return new StorageStatistics(files, size);
        } catch (IOException e) {
            log.warn("统计目录失败: dir={}, error={}", dir, e.getMessage());
            return new StorageStatistics(0, 0);
        }
    }

    private Path write(Path target, byte[] bytes) throws IOException {
        ensureDirectory(target.getParent());
        Files.write(target, bytes);
        return target;
    }

    private void ensureDirectory(Path dir) throws IOException {
        if (dir != null && Files.notExists(dir)) {
            Files.createDirectories(dir);
            log.info("创建目录: {}", dir);
        }
    }

    private static String extensionOf(String filename) {
        if (filename == null) {
            return DEFAULT_EXTENSION;
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0) {
            return DEFAULT_EXTENSION;
        }
        String ext = filename.substring(dot).toLowerCase(Locale.ROOT);
        return EXTENSION_PATTERN.matcher(ext).matches() ? ext : DEFAULT_EXTENSION;
    }

    private static String checkName(String name) {
        if (name == null || name.isEmpty() || name.contains("/") || name.contains("\\") || name.contains("..")) {
            throw new IllegalArgumentException("非法文件名: " + name);
        }
        return name;
    }
}
