package fr.lapetina.arena.infrastructure.store;

import fr.lapetina.arena.domain.model.VoteRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * SQLite-backed vote store.
 *
 * Opens a short-lived connection per operation; writes come from a single
 * pipeline thread so there is no contention on the database file.
 */
public final class SqliteVoteStore implements VoteStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteVoteStore.class);

    private final Path databasePath;

    public SqliteVoteStore(Path databasePath) {
        this.databasePath = databasePath;
    }

    /**
     * Creates the database file, table and indexes.
     *
     * @throws IllegalStateException if the schema cannot be created
     */
    public void initialize() {
        try {
            Path parent = databasePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create directory for " + databasePath, e);
        }

        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.executeUpdate("""
                CREATE TABLE IF NOT EXISTS arena_votes (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    round_id TEXT NOT NULL,
                    session_id TEXT,
                    model_a TEXT NOT NULL,
                    model_b TEXT NOT NULL,
                    prompt_hash TEXT NOT NULL,
                    vote TEXT NOT NULL,
                    voted_at TEXT NOT NULL
                )
                """);
            statement.executeUpdate(
                    "CREATE INDEX IF NOT EXISTS idx_arena_votes_models ON arena_votes(voted_at, model_a, model_b)");
            statement.executeUpdate(
                    "CREATE INDEX IF NOT EXISTS idx_arena_votes_prompt ON arena_votes(prompt_hash)");
            statement.executeUpdate(
                    "CREATE INDEX IF NOT EXISTS idx_arena_votes_vote ON arena_votes(vote, voted_at)");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize vote database at " + databasePath, e);
        }
        log.info("SQLite vote store initialized: path={}", databasePath);
    }

    @Override
    public VoteStoreResult insert(VoteRecord vote) {
        Connection connection;
        try {
            connection = openConnection();
        } catch (SQLException e) {
            log.error("Vote database unavailable: path={}, roundId={}", databasePath, vote.roundId(), e);
            return VoteStoreResult.failure(VoteStoreResult.FailureKind.UNAVAILABLE, e.getMessage());
        }

        try (Connection open = connection;
             PreparedStatement statement = open.prepareStatement("""
                 INSERT INTO arena_votes (round_id, session_id, model_a, model_b, prompt_hash, vote, voted_at)
                 VALUES (?, ?, ?, ?, ?, ?, ?)
                 """)) {
            statement.setString(1, vote.roundId());
            statement.setString(2, vote.sessionId());
            statement.setString(3, vote.modelA());
            statement.setString(4, vote.modelB());
            statement.setString(5, vote.promptHash());
            statement.setString(6, vote.choice().label());
            statement.setString(7, vote.votedAt().toString());
            statement.executeUpdate();
            log.debug("Vote stored: roundId={}, choice={}", vote.roundId(), vote.choice().label());
            return VoteStoreResult.ok();
        } catch (SQLException e) {
            log.error("Failed to write vote: roundId={}", vote.roundId(), e);
            return VoteStoreResult.failure(VoteStoreResult.FailureKind.WRITE_ERROR, e.getMessage());
        }
    }

    @Override
    public long count() {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT COUNT(*) FROM arena_votes")) {
            return resultSet.next() ? resultSet.getLong(1) : 0L;
        } catch (SQLException e) {
            log.warn("Failed to count votes: path={}, error={}", databasePath, e.getMessage());
            return -1L;
        }
    }

    @Override
    public String name() {
        return "sqlite";
    }

    public Path databasePath() {
        return databasePath;
    }

    private Connection openConnection() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + databasePath.toAbsolutePath());
    }
}
