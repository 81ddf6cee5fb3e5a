package com.agentos.core.cost;

import com.agentos.core.llm.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link CostStore} persisted in a relational table, so month-to-date spend and budget
 * checks survive restarts and are shared by every process pointing at the same database.
 * <p>
 * The table {@code llm_costs} is created by {@link #createTables()}.
 */
public class JdbcCostStore implements CostStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCostStore.class);

    private static final String TABLE_NAME = "llm_costs";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id            BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                recorded_at   TIMESTAMP NOT NULL,
                stage         VARCHAR(32) NOT NULL,
                model_alias   VARCHAR(255) NOT NULL,
                input_tokens  BIGINT NOT NULL,
                output_tokens BIGINT NOT NULL,
                cost          DOUBLE PRECISION NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS idx_%s_recorded_at ON %s (recorded_at)
            """.formatted(TABLE_NAME, TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (recorded_at, stage, model_alias, input_tokens, output_tokens, cost)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_SINCE_SQL = """
            SELECT recorded_at, stage, model_alias, input_tokens, output_tokens, cost
            FROM %s
            WHERE recorded_at >= ?
            ORDER BY recorded_at ASC, id ASC
            """.formatted(TABLE_NAME);

    private static final RowMapper<CostRecord> ROW_MAPPER = (rs, rowNum) -> new CostRecord(
            rs.getTimestamp("recorded_at").toInstant(),
            PipelineStage.valueOf(rs.getString("stage").toUpperCase(Locale.ROOT)),
            rs.getString("model_alias"),
            rs.getLong("input_tokens"),
            rs.getLong("output_tokens"),
            rs.getDouble("cost"));

    private final JdbcTemplate jdbc;

    public JdbcCostStore(JdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc, "JdbcTemplate must not be null");
    }

    /**
     * Creates the cost table and its timestamp index if they do not already exist.
     */
    public void createTables() {
        jdbc.execute(CREATE_TABLE_SQL);
        jdbc.execute(CREATE_INDEX_SQL);
        log.info("Cost table '{}' ensured", TABLE_NAME);
    }

    @Override
    public void append(CostRecord record) {
        jdbc.update(INSERT_SQL,
                Timestamp.from(record.timestamp()),
                record.stage().configKey(),
                record.modelAlias(),
                record.inputTokens(),
                record.outputTokens(),
                record.cost());
    }

    @Override
    public List<CostRecord> findSince(Instant from) {
        return jdbc.query(SELECT_SINCE_SQL, ROW_MAPPER, Timestamp.from(from));
    }
}
