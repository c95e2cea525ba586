package com.flow.store;

import com.flow.model.InstrumentKey;
import com.flow.model.OptionSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Plain-JDBC {@link BaselineRepository} over table {@code baseline_daily_stats}.
 * The upsert uses the H2 {@code MERGE ... KEY} form.
 */
public class JdbcBaselineRepository implements BaselineRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcBaselineRepository.class);

    private final DataSource dataSource;

    public JdbcBaselineRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void upsert(DailyStats daily) {
        String sql = """
            MERGE INTO baseline_daily_stats
                (strike, side, trade_day, sample_count, mean_ratio, m2, min_ratio, max_ratio, last_window_start)
            KEY (strike, side, trade_day)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        RunningStats stats = daily.stats();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setDouble(1, daily.key().strike());
            ps.setString(2, daily.key().side().getCode());
            ps.setObject(3, daily.day());
            ps.setLong(4, stats.count());
            ps.setDouble(5, stats.mean());
            ps.setDouble(6, stats.m2());
            ps.setDouble(7, stats.min());
            ps.setDouble(8, stats.max());
            ps.setLong(9, daily.lastWindowStart());
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to upsert baseline stats for key={} day={}: {}", daily.key(), daily.day(), e.getMessage());
            throw new BaselinePersistenceException("Failed to upsert baseline stats", e);
        }
    }

    @Override
    public List<DailyStats> loadSince(LocalDate fromDay) {
        String sql = """
            SELECT strike, side, trade_day, sample_count, mean_ratio, m2, min_ratio, max_ratio, last_window_start
            FROM baseline_daily_stats
            WHERE trade_day >= ?
            ORDER BY trade_day ASC, strike ASC, side ASC
            """;

        List<DailyStats> result = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, fromDay);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    mapRow(rs).ifPresent(result::add);
                }
            }

        } catch (SQLException e) {
            log.error("Failed to load baseline stats since {}: {}", fromDay, e.getMessage());
            throw new BaselinePersistenceException("Failed to load baseline stats", e);
        }

        log.debug("Loaded {} baseline rows since {}", result.size(), fromDay);
        return result;
    }

    @Override
    public int deleteBefore(LocalDate day) {
        String sql = "DELETE FROM baseline_daily_stats WHERE trade_day < ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, day);
            return ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to delete baseline stats before {}: {}", day, e.getMessage());
            throw new BaselinePersistenceException("Failed to delete baseline stats", e);
        }
    }

    private Optional<DailyStats> mapRow(ResultSet rs) throws SQLException {
        String code = rs.getString("side");
        Optional<OptionSide> side = OptionSide.fromCode(code);
        if (side.isEmpty()) {
            log.warn("Skipping baseline row with unknown side '{}'", code);
            return Optional.empty();
        }
        InstrumentKey key = new InstrumentKey(rs.getDouble("strike"), side.get());
        RunningStats stats = new RunningStats(
                rs.getLong("sample_count"),
                rs.getDouble("mean_ratio"),
                rs.getDouble("m2"),
                rs.getDouble("min_ratio"),
                rs.getDouble("max_ratio"));
        return Optional.of(new DailyStats(key, rs.getObject("trade_day", LocalDate.class), stats,
                rs.getLong("last_window_start")));
    }
}
