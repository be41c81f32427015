package org.csits.butler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * 启动类。
 *
 * 示例：
 *  java -jar butler-start.jar --butler.provider.api-key=xxx
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "org.csits.butler")
public class ButlerApplication {

    static final String DATA_DIR = "data";

    public static void main(String[] args) {
        prepareDataDirectory();
        SpringApplication.run(ButlerApplication.class, args);
    }

    /**
     * SQLite 不会自动创建数据库所在目录
     */
    static void prepareDataDirectory() {
        try {
            Files.createDirectories(Paths.get(DATA_DIR));
        } catch (IOException e) {
            log.warn("创建数据目录失败，任务将只保存在内存中: {}", e.getMessage());
        }
    }
}
