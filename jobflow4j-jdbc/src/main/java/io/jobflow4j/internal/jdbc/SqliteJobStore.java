package io.jobflow4j.internal.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobflow4j.core.Job;
import io.jobflow4j.core.JobStatus;
import io.jobflow4j.store.JobRecord;
import io.jobflow4j.store.JobStore;
import io.jobflow4j.store.JobStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * SQLite job store. One row per job in the {@code jobs} table; timestamps are epoch milliseconds
 * and structured fields are JSON text.
 *
 * <p>Backed by a {@link DriverManagerDataSource}, so every operation opens its own connection.
 */
public class SqliteJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteJobStore.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {
    };

    private static final String COLUMNS = "id, name, command, parameters, status, priority, created_at, "
            + "scheduled_at, started_at, completed_at, retry_count, max_retries, timeout, tags, metadata, "
            + "error_message, result";

    private static final String[] SCHEMA = {
            """
            CREATE TABLE IF NOT EXISTS jobs (
              id TEXT PRIMARY KEY,
              name TEXT NOT NULL,
              command TEXT NOT NULL,
              parameters TEXT,
              status TEXT NOT NULL,
              priority INTEGER NOT NULL,
              created_at INTEGER NOT NULL,
              scheduled_at INTEGER,
              started_at INTEGER,
              completed_at INTEGER,
              retry_count INTEGER NOT NULL DEFAULT 0,
              max_retries INTEGER NOT NULL DEFAULT 3,
              timeout INTEGER,
              tags TEXT,
              metadata TEXT,
              error_message TEXT,
              result TEXT
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status)",
            "CREATE INDEX IF NOT EXISTS idx_jobs_priority ON jobs(priority)",
            "CREATE INDEX IF NOT EXISTS idx_jobs_created_at ON jobs(created_at)",
            "CREATE INDEX IF NOT EXISTS idx_jobs_scheduled_at ON jobs(scheduled_at)"
    };

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<Job> rowMapper = this::mapRow;

    public SqliteJobStore(Path databaseFile, ObjectMapper objectMapper) {
        this(new JdbcTemplate(dataSource(databaseFile)), objectMapper);
        log.info("jobflow sqlite store ready file={}", databaseFile.toAbsolutePath());
    }

    public SqliteJobStore(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        initSchema();
    }

    private static DriverManagerDataSource dataSource(Path databaseFile) {
        Objects.requireNonNull(databaseFile, "databaseFile must not be null");
        Path parent = databaseFile.toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new JobStoreException("Failed to create directory for SQLite database: " + parent, e);
            }
        }
        DriverManagerDataSource ds = new DriverManagerDataSource("jdbc:sqlite:" + databaseFile);
        ds.setDriverClassName("org.sqlite.JDBC");
        Properties props = new Properties();
        props.setProperty("busy_timeout", "5000");
        ds.setConnectionProperties(props);
        return ds;
    }

    private void initSchema() {
        try {
            jdbc.queryForObject("PRAGMA journal_mode=WAL", String.class);
            for (String ddl : SCHEMA) {
                jdbc.execute(ddl);
            }
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to initialize SQLite schema", e);
        }
    }

    @Override
    public void save(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        JobRecord r = JobRecord.from(job);
        try {
            jdbc.update("INSERT OR REPLACE INTO jobs (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    r.id(),
                    r.name(),
                    r.command(),
                    toJson(r.parameters()),
                    r.status(),
                    r.priority(),
                    r.createdAt(),
                    r.scheduledAt(),
                    r.startedAt(),
                    r.completedAt(),
                    r.retryCount(),
                    r.maxRetries(),
                    r.timeout(),
                    toJson(r.tags()),
                    toJson(r.metadata()),
                    r.errorMessage(),
                    toJson(r.result()));
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to save job " + job.getId(), e);
        }
    }

    @Override
    public Optional<Job> get(String id) {
        try {
            List<Job> rows = jdbc.query("SELECT " + COLUMNS + " FROM jobs WHERE id = ?", rowMapper, id);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to load job " + id, e);
        }
    }

    @Override
    public boolean delete(String id) {
        try {
            return jdbc.update("DELETE FROM jobs WHERE id = ?", id) > 0;
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to delete job " + id, e);
        }
    }

    @Override
    public List<Job> list(JobStatus status, Integer limit) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM jobs");
        List<Object> args = new ArrayList<>();
        if (status != null) {
            sql.append(" WHERE status = ?");
            args.add(status.name());
        }
        sql.append(" ORDER BY created_at DESC");
        if (limit != null) {
            sql.append(" LIMIT ?");
            args.add(limit);
        }
        try {
            return jdbc.query(sql.toString(), rowMapper, args.toArray());
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to list jobs", e);
        }
    }

    @Override
    public long count(JobStatus status) {
        try {
            Long n = status == null
                    ? jdbc.queryForObject("SELECT COUNT(*) FROM jobs", Long.class)
                    : jdbc.queryForObject("SELECT COUNT(*) FROM jobs WHERE status = ?", Long.class, status.name());
            return n == null ? 0 : n;
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to count jobs", e);
        }
    }

    @Override
    public int cleanup(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        List<Object> args = new ArrayList<>();
        args.add(cutoff.toEpochMilli());
        StringBuilder in = new StringBuilder();
        for (JobStatus s : JobStatus.cleanupEligible()) {
            in.append(in.length() == 0 ? "?" : ", ?");
            args.add(s.name());
        }
        try {
            return jdbc.update("DELETE FROM jobs WHERE created_at < ? AND status IN (" + in + ")", args.toArray());
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to clean up jobs", e);
        }
    }

    @Override
    public boolean healthCheck() {
        Integer one = jdbc.queryForObject("SELECT 1", Integer.class);
        return one != null && one == 1;
    }

    /* ================= helper ================= */

    private Job mapRow(ResultSet rs, int rowNum) throws SQLException {
        JobRecord r = new JobRecord(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("command"),
                fromJson(rs.getString("parameters"), MAP_TYPE),
                rs.getString("status"),
                rs.getInt("priority"),
                rs.getLong("created_at"),
                nullableLong(rs, "scheduled_at"),
                nullableLong(rs, "started_at"),
                nullableLong(rs, "completed_at"),
                rs.getInt("retry_count"),
                rs.getInt("max_retries"),
                rs.getObject("timeout") == null ? null : rs.getInt("timeout"),
                fromJson(rs.getString("tags"), LIST_TYPE),
                fromJson(rs.getString("metadata"), MAP_TYPE),
                rs.getString("error_message"),
                fromJson(rs.getString("result"), MAP_TYPE)
        );
        return r.toJob();
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Failed to encode job field: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) throws SQLException {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt JSON column: " + e.getOriginalMessage(), e);
        }
    }
}
