package org.csits.butler.dao;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

class DatabaseTaskPersistenceTest {

    @TempDir
    Path tempDir;

    private DriverManagerDataSource dataSource;
    private DatabaseTaskPersistence persistence;

    @BeforeEach
    void setUp() {
        dataSource = new DriverManagerDataSource("jdbc:sqlite:" + tempDir.resolve("test.db"));
        dataSource.setDriverClassName("org.sqlite.JDBC");
        persistence = new DatabaseTaskPersistence(new JdbcTemplate(dataSource));
    }

    private void createSchema() {
        new ResourceDatabasePopulator(new ClassPathResource("db/schema.sql")).execute(dataSource);
    }

    private GenerationTaskEntity newTask(String id, Instant createdAt) {
        GenerationTaskEntity entity = new GenerationTaskEntity();
        entity.setId(id);
        entity.setOwnerId("u1");
        entity.setTemplateId("watercolor");
        entity.setOriginalImageRef("/uploads/originals/" + id + "_original.jpg");
        entity.setStatus(GenerationTaskStatus.PENDING);
        entity.setCreatedAt(createdAt);
        entity.setUpdatedAt(createdAt);
        return entity;
    }

    @Test
    void isAvailable_falseWithoutTable() {
        assertThat(persistence.isAvailable()).isFalse();
    }

    @Test
    void isAvailable_trueOnceSchemaExists() {
        assertThat(persistence.isAvailable()).isFalse();
        createSchema();
        assertThat(persistence.isAvailable()).isTrue();
    }

    @Test
    void save_upsertsAndFindAllMapsAllColumns() {
        createSchema();
        Instant created = Instant.parse("2025-01-01T10:00:00Z");
        GenerationTaskEntity entity = newTask("t1", created);
        entity.setCustomPrompt("soft light");
        persistence.save(entity);

        entity.setStatus(GenerationTaskStatus.COMPLETED);
        entity.setProgress(100);
        entity.setGeneratedImageRef("/uploads/generated/t1_generated.jpg");
        entity.setCompletedAt(created.plusSeconds(30));
        entity.setUpdatedAt(created.plusSeconds(30));
        persistence.save(entity);

        List<GenerationTaskEntity> all = persistence.findAll();
        assertThat(all).hasSize(1);
        GenerationTaskEntity loaded = all.get(0);
        assertThat(loaded.getStatus()).isEqualTo(GenerationTaskStatus.COMPLETED);
        assertThat(loaded.getProgress()).isEqualTo(100);
        assertThat(loaded.getCustomPrompt()).isEqualTo("soft light");
        assertThat(loaded.getErrorMessage()).isNull();
        assertThat(loaded.getCreatedAt()).isEqualTo(created);
        assertThat(loaded.getCompletedAt()).isEqualTo(created.plusSeconds(30));
        assertThat(loaded.getGeneratedImageRef()).isEqualTo("/uploads/generated/t1_generated.jpg");
    }

    @Test
    void findAll_ordersByCreatedAtDescending() {
        createSchema();
        persistence.save(newTask("old", Instant.parse("2025-01-01T10:00:00Z")));
        persistence.save(newTask("new", Instant.parse("2025-01-02T10:00:00Z")));

        assertThat(persistence.findAll()).extracting(GenerationTaskEntity::getId)
            .containsExactly("new", "old");
    }

    @Test
    void deleteById_removesRecord() {
        createSchema();
        persistence.save(newTask("t1", Instant.now()));

        persistence.deleteById("t1");
        persistence.deleteById("missing");

        assertThat(persistence.findAll()).isEmpty();
    }
}
