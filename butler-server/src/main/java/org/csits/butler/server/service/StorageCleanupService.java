package org.csits.butler.server.service;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.csits.butler.manager.storage.ImageStorage;
import org.csits.butler.manager.storage.StorageStatistics;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * 存储清理服务，定时删除过期的临时文件。
 */
@Slf4j
@Service
public class StorageCleanupService {

    private final ImageStorage imageStorage;
    private final Duration tempMaxAge;

    public StorageCleanupService(ImageStorage imageStorage,
                                 @Value("${butler.cleanup.temp-max-age-hours:24}") long tempMaxAgeHours) {
        this.imageStorage = imageStorage;
        this.tempMaxAge = Duration.ofHours(tempMaxAgeHours);
    }

    @Scheduled(fixedDelayString = "${butler.cleanup.interval-ms:3600000}",
        initialDelayString = "${butler.cleanup.initial-delay-ms:60000}")
    public void scheduledCleanup() {
        cleanup();
    }

    /**
     * @return 删除的文件数，清理失败返回 -1
     */
    public int cleanup() {
        try {
            int deleted = imageStorage.cleanupTemp(tempMaxAge);
            log.info("临时文件清理完成: deleted={}, maxAge={}h", deleted, tempMaxAge.toHours());
            return deleted;
        } catch (IOException e) {
            log.error("临时文件清理失败: {}", e.getMessage(), e);
            return -1;
        }
    }

    public Map<String, StorageStatistics> statistics() {
        return imageStorage.statistics();
    }
}
