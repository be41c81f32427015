package org.csits.butler.dao;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * 基于数据库的任务持久化实现，时间字段以 ISO-8601 字符串存储。
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "butler.persistence.type", havingValue = "database", matchIfMissing = true)
@RequiredArgsConstructor
public class DatabaseTaskPersistence implements TaskPersistence {

    private final JdbcTemplate jdbcTemplate;

    private volatile boolean available;

    private static final String PROBE_SQL =
        "SELECT COUNT(*) FROM tasks";

    private static final String UPSERT_SQL =
        "INSERT OR REPLACE INTO tasks (id, user_id, template_id, original_image_url, generated_image_url, " +
        "status, progress, custom_prompt, error_message, created_at, updated_at, completed_at) " +
        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SELECT_ALL_SQL =
        "SELECT id, user_id, template_id, original_image_url, generated_image_url, status, progress, " +
        "custom_prompt, error_message, created_at, updated_at, completed_at FROM tasks ORDER BY created_at DESC";

    private static final String DELETE_SQL =
        "DELETE FROM tasks WHERE id = ?";

    /**
     * 首次探测成功后缓存结果；失败不缓存，便于启动阶段重试。
     */
    @Override
    public boolean isAvailable() {
        if (available) {
            return true;
        }
        try {
            jdbcTemplate.queryForObject(PROBE_SQL, Long.class);
            available = true;
            log.info("任务持久化存储可用");
        } catch (Exception e) {
            log.debug("任务持久化存储不可用: {}", e.getMessage());
        }
        return available;
    }

    @Override
    public void save(GenerationTaskEntity entity) {
        jdbcTemplate.update(UPSERT_SQL,
            entity.getId(),
            entity.getOwnerId(),
            entity.getTemplateId(),
            entity.getOriginalImageRef(),
            entity.getGeneratedImageRef(),
            entity.getStatus() != null ? entity.getStatus().name() : null,
            entity.getProgress(),
            entity.getCustomPrompt(),
            entity.getErrorMessage(),
            toText(entity.getCreatedAt()),
            toText(entity.getUpdatedAt()),
            toText(entity.getCompletedAt())
        );
        log.debug("保存任务记录: id={}, status={}, progress={}",
            entity.getId(), entity.getStatus(), entity.getProgress());
    }

    @Override
    public void deleteById(String id) {
        int rows = jdbcTemplate.update(DELETE_SQL, id);
        if (rows > 0) {
            log.debug("删除任务记录: id={}", id);
        }
    }

    @Override
    public List<GenerationTaskEntity> findAll() {
        return jdbcTemplate.query(SELECT_ALL_SQL, new GenerationTaskRowMapper());
    }

    /**
     * RowMapper实现
     */
    private static class GenerationTaskRowMapper implements RowMapper<GenerationTaskEntity> {
        @Override
        public GenerationTaskEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
            GenerationTaskEntity entity = new GenerationTaskEntity();
            entity.setId(rs.getString("id"));
            entity.setOwnerId(rs.getString("user_id"));
            entity.setTemplateId(rs.getString("template_id"));
            entity.setOriginalImageRef(rs.getString("original_image_url"));
            entity.setGeneratedImageRef(rs.getString("generated_image_url"));
            entity.setStatus(toStatus(rs.getString("status")));
            entity.setProgress(rs.getInt("progress"));
            entity.setCustomPrompt(rs.getString("custom_prompt"));
            entity.setErrorMessage(rs.getString("error_message"));
            entity.setCreatedAt(toInstant(rs.getString("created_at")));
            entity.setUpdatedAt(toInstant(rs.getString("updated_at")));
            entity.setCompletedAt(toInstant(rs.getString("completed_at")));
            return entity;
        }
    }

    private static GenerationTaskStatus toStatus(String value) {
        return value != null ? GenerationTaskStatus.valueOf(value.toUpperCase()) : GenerationTaskStatus.PENDING;
    }

    private static String toText(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    private static Instant toInstant(String text) {
        return text != null && !text.isEmpty() ? Instant.parse(text) : null;
    }
}
