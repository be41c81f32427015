package org.csits.butler.web.controller;

import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.butler.manager.storage.StorageStatistics;
import org.csits.butler.server.service.StorageCleanupService;
import org.csits.butler.web.dto.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 系统维护API接口
 */
@Slf4j
@RestController
@RequestMapping("/api/system")
@RequiredArgsConstructor
public class SystemController {

    private final StorageCleanupService storageCleanupService;

    /**
     * 获取存储统计
     */
    @GetMapping("/storage")
    public ResponseEntity<ApiResponse<Map<String, StorageStatistics>>> getStorage() {
        return ResponseEntity.ok(ApiResponse.ok(storageCleanupService.statistics()));
    }

    /**
     * 手动清理临时文件
     */
    @PostMapping("/cleanup")
    public ResponseEntity<ApiResponse<Map<String, Object>>> cleanup() {
        int deleted = storageCleanupService.cleanup();
        if (deleted < 0) {
            return ResponseEntity.internalServerError().body(ApiResponse.error("清理临时文件失败"));
        }
        log.info("手动清理临时文件: deleted={}", deleted);
        Map<String, Object> body = new HashMap<>();
        body.put("deleted", deleted);
        return ResponseEntity.ok(ApiResponse.ok(body));
    }
}
