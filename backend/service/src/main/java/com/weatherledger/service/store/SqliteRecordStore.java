package com.weatherledger.service.store;

import com.weatherledger.core.model.Forecast;
import com.weatherledger.core.model.Observation;
import com.weatherledger.core.model.RecordKind;
import com.weatherledger.ingest.api.InsertOutcome;
import com.weatherledger.ingest.api.RecordStore;
import com.weatherledger.ingest.api.StoreUnavailableException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link RecordStore} backed by a single SQLite file.
 *
 * <p>Uniqueness is enforced by the schema: observations on {@code (location, observation_timestamp)},
 * forecasts on {@code (location, forecast_timestamp, scrape_timestamp)}. Inserts use
 * {@code ON CONFLICT DO NOTHING}, so the duplicate check and the write are a single statement and
 * concurrent writers cannot both insert the same key. The connection runs in auto-commit mode, so each
 * insert is committed before it returns.
 */
public final class SqliteRecordStore implements RecordStore, AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(SqliteRecordStore.class.getName());
    static final int BUSY_TIMEOUT_MILLIS = 10_000;

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS observations (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                scrape_timestamp TEXT NOT NULL,
                observation_timestamp TEXT NOT NULL,
                location TEXT NOT NULL,
                temperature_f REAL,
                dew_point_f REAL,
                humidity_pct INTEGER,
                wind_speed_mph REAL,
                wind_direction TEXT,
                wind_gust_mph REAL,
                pressure_in REAL,
                precip_amount_in REAL,
                condition TEXT,
                water_temp_0_35m_c REAL,
                water_temp_2m_c REAL,
                water_temp_7m_c REAL,
                water_temp_entry_id INTEGER,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                UNIQUE(location, observation_timestamp)
            )""",
            """
            CREATE TABLE IF NOT EXISTS forecasts (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                scrape_timestamp TEXT NOT NULL,
                forecast_timestamp TEXT NOT NULL,
                location TEXT NOT NULL,
                temperature_f REAL,
                feels_like_f REAL,
                dew_point_f REAL,
                humidity_pct INTEGER,
                wind_speed_mph REAL,
                wind_direction TEXT,
                pressure_in REAL,
                precip_chance_pct INTEGER,
                precip_amount_in REAL,
                cloud_cover_pct INTEGER,
                condition TEXT,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                UNIQUE(location, forecast_timestamp, scrape_timestamp)
            )""",
            "CREATE INDEX IF NOT EXISTS idx_obs_timestamp ON observations(observation_timestamp)",
            "CREATE INDEX IF NOT EXISTS idx_obs_location ON observations(location)",
            "CREATE INDEX IF NOT EXISTS idx_forecast_timestamp ON forecasts(forecast_timestamp)",
            "CREATE INDEX IF NOT EXISTS idx_forecast_scrape ON forecasts(scrape_timestamp)"
    );

    private static final String INSERT_OBSERVATION = """
            INSERT INTO observations (
                scrape_timestamp, observation_timestamp, location, temperature_f, dew_point_f, humidity_pct,
                wind_speed_mph, wind_direction, wind_gust_mph, pressure_in, precip_amount_in, condition,
                water_temp_0_35m_c, water_temp_2m_c, water_temp_7m_c, water_temp_entry_id
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(location, observation_timestamp) DO NOTHING""";

    private static final String INSERT_FORECAST = """
            INSERT INTO forecasts (
                scrape_timestamp, forecast_timestamp, location, temperature_f, feels_like_f, dew_point_f,
                humidity_pct, wind_speed_mph, wind_direction, pressure_in, precip_chance_pct,
                precip_amount_in, cloud_cover_pct, condition
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(location, forecast_timestamp, scrape_timestamp) DO NOTHING""";

    private final Path file;
    private final Connection connection;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean schemaReady;

    private SqliteRecordStore(Path file, Connection connection) {
        this.file = file;
        this.connection = connection;
    }

    /**
     * Opens (creating if needed) the database file and its schema.
     */
    public static SqliteRecordStore open(Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed opening record store at " + file, e);
        }
        Connection connection;
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath());
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed opening record store at " + file, e);
        }
        SqliteRecordStore store = new SqliteRecordStore(file, connection);
        try {
            store.waitWhenLocked();
            store.ensureSchema();
        } catch (StoreUnavailableException e) {
            store.close();
            throw e;
        }
        LOGGER.info("Opened record store at " + file.toAbsolutePath());
        return store;
    }

    public Path file() {
        return file;
    }

    // Other processes or store instances may hold the file's write lock; wait for it rather than fail.
    private void waitWhenLocked() {
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA busy_timeout = " + BUSY_TIMEOUT_MILLIS);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed configuring record store at " + file, e);
        }
    }

    void ensureSchema() {
        if (schemaReady) {
            return;
        }
        lock.lock();
        try {
            if (schemaReady) {
                return;
            }
            try (Statement statement = connection.createStatement()) {
                for (String ddl : SCHEMA) {
                    statement.execute(ddl);
                }
            }
            schemaReady = true;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed creating schema in " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public InsertOutcome insert(Observation observation) {
        ensureSchema();
        lock.lock();
        try (PreparedStatement ps = connection.prepareStatement(INSERT_OBSERVATION)) {
            ps.setString(1, observation.scrapedAt().toString());
            ps.setString(2, observation.observedAt().toString());
            ps.setString(3, observation.location());
            setDouble(ps, 4, observation.temperatureF());
            setDouble(ps, 5, observation.dewPointF());
            setInt(ps, 6, observation.humidityPct());
            setDouble(ps, 7, observation.windSpeedMph());
            setText(ps, 8, observation.windDirection());
            setDouble(ps, 9, observation.windGustMph());
            setDouble(ps, 10, observation.pressureIn());
            setDouble(ps, 11, observation.precipAmountIn());
            setText(ps, 12, observation.condition());
            setDouble(ps, 13, observation.waterTemp0p35mC());
            setDouble(ps, 14, observation.waterTemp2mC());
            setDouble(ps, 15, observation.waterTemp7mC());
            setLong(ps, 16, observation.waterTempEntryId());
            return ps.executeUpdate() == 1 ? InsertOutcome.INSERTED : InsertOutcome.SKIPPED;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed inserting observation "
                    + observation.location() + "@" + observation.observedAt() + " into " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public InsertOutcome insert(Forecast forecast) {
        ensureSchema();
        lock.lock();
        try (PreparedStatement ps = connection.prepareStatement(INSERT_FORECAST)) {
            ps.setString(1, forecast.scrapedAt().toString());
            ps.setString(2, forecast.forecastAt().toString());
            ps.setString(3, forecast.location());
            setDouble(ps, 4, forecast.temperatureF());
            setDouble(ps, 5, forecast.feelsLikeF());
            setDouble(ps, 6, forecast.dewPointF());
            setInt(ps, 7, forecast.humidityPct());
            setDouble(ps, 8, forecast.windSpeedMph());
            setText(ps, 9, forecast.windDirection());
            setDouble(ps, 10, forecast.pressureIn());
            setInt(ps, 11, forecast.precipChancePct());
            setDouble(ps, 12, forecast.precipAmountIn());
            setInt(ps, 13, forecast.cloudCoverPct());
            setText(ps, 14, forecast.condition());
            return ps.executeUpdate() == 1 ? InsertOutcome.INSERTED : InsertOutcome.SKIPPED;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed inserting forecast "
                    + forecast.location() + "@" + forecast.forecastAt() + " into " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long count(RecordKind kind, Optional<String> location) {
        ensureSchema();
        String table = kind == RecordKind.OBSERVATION ? "observations" : "forecasts";
        String sql = "SELECT COUNT(*) FROM " + table + (location.isPresent() ? " WHERE location = ?" : "");
        lock.lock();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            if (location.isPresent()) {
                ps.setString(1, location.get());
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed counting " + table + " in " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Observation> findObservation(String location, Instant observedAt) {
        ensureSchema();
        lock.lock();
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT * FROM observations WHERE location = ? AND observation_timestamp = ?")) {
            ps.setString(1, location);
            ps.setString(2, observedAt.toString());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readObservation(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed reading observation from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Forecast> findForecasts(String location, Instant forecastAt) {
        ensureSchema();
        List<Forecast> forecasts = new ArrayList<>();
        lock.lock();
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT * FROM forecasts WHERE location = ? AND forecast_timestamp = ?")) {
            ps.setString(1, location);
            ps.setString(2, forecastAt.toString());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    forecasts.add(readForecast(rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed reading forecasts from " + file, e);
        } finally {
            lock.unlock();
        }
        // Instant.toString drops trailing zero fractions, so text order is not time order.
        forecasts.sort(Comparator.comparing(Forecast::scrapedAt));
        return forecasts;
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            LOGGER.log(Level.WARNING, "Failed closing record store at " + file, e);
        }
    }

    private static Observation readObservation(ResultSet rs) throws SQLException {
        return new Observation(
                rs.getString("location"),
                Instant.parse(rs.getString("observation_timestamp")),
                Instant.parse(rs.getString("scrape_timestamp")),
                getDouble(rs, "temperature_f"),
                getDouble(rs, "dew_point_f"),
                getInt(rs, "humidity_pct"),
                getDouble(rs, "wind_speed_mph"),
                rs.getString("wind_direction"),
                getDouble(rs, "wind_gust_mph"),
                getDouble(rs, "pressure_in"),
                getDouble(rs, "precip_amount_in"),
                rs.getString("condition"),
                getDouble(rs, "water_temp_0_35m_c"),
                getDouble(rs, "water_temp_2m_c"),
                getDouble(rs, "water_temp_7m_c"),
                getLong(rs, "water_temp_entry_id")
        );
    }

    private static Forecast readForecast(ResultSet rs) throws SQLException {
        return new Forecast(
                rs.getString("location"),
                Instant.parse(rs.getString("forecast_timestamp")),
                Instant.parse(rs.getString("scrape_timestamp")),
                getDouble(rs, "temperature_f"),
                getDouble(rs, "feels_like_f"),
                getDouble(rs, "dew_point_f"),
                getInt(rs, "humidity_pct"),
                getDouble(rs, "wind_speed_mph"),
                rs.getString("wind_direction"),
                getDouble(rs, "pressure_in"),
                getInt(rs, "precip_chance_pct"),
                getDouble(rs, "precip_amount_in"),
                getInt(rs, "cloud_cover_pct"),
                rs.getString("condition")
        );
    }

    private static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.REAL);
        } else {
            ps.setDouble(index, value);
        }
    }

    private static void setInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private static void setLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    private static void setText(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    private static Double getDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer getInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Long getLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
