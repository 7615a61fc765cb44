package com.flagship.drink_ledger.store;

import com.flagship.drink_ledger.ledger.DrinkType;
import com.flagship.drink_ledger.ledger.PostpaidUser;
import com.flagship.drink_ledger.ledger.PrepaidUser;
import com.flagship.drink_ledger.ledger.exception.ConflictException;
import com.flagship.drink_ledger.ledger.exception.NotFoundException;
import com.flagship.drink_ledger.ledger.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * PostgreSQL-backed ledger store.
 *
 * Uses JDBC directly so that uniqueness and ownership are enforced by the
 * database itself (UNIQUE and FOREIGN KEY constraints from schema.sql).
 *
 * Inside a transaction, point lookups take row locks ({@code FOR UPDATE}),
 * so a read-modify-write on a record cannot lose a concurrent update.
 */
@Slf4j
public class JdbcLedgerStore implements LedgerStore {

    private static final String POSTPAID_COLUMNS = "id, username, money, activated, last_drink";
    private static final String PREPAID_COLUMNS =
        "id, username, user_key, postpaid_user_id, money, activated, last_drink";
    private static final String DRINK_TYPE_COLUMNS = "id, drink_name, icon, quantity, consumed";

    // PostgreSQL foreign_key_violation
    private static final String FOREIGN_KEY_VIOLATION = "23503";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcLedgerStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public Optional<PostpaidUser> findPostpaid(String username) {
        return guard(() -> queryOptional(
            "SELECT " + POSTPAID_COLUMNS + " FROM users_postpaid WHERE username = ?" + lockClause(),
            postpaidRowMapper(), username));
    }

    @Override
    public Optional<PostpaidUser> findPostpaidById(long id) {
        return guard(() -> queryOptional(
            "SELECT " + POSTPAID_COLUMNS + " FROM users_postpaid WHERE id = ?" + lockClause(),
            postpaidRowMapper(), id));
    }

    @Override
    public List<PostpaidUser> listPostpaid() {
        return guard(() -> jdbcTemplate.query(
            "SELECT " + POSTPAID_COLUMNS + " FROM users_postpaid ORDER BY id",
            postpaidRowMapper()));
    }

    @Override
    public PostpaidUser upsertPostpaid(PostpaidUser user) {
        return inTransaction(() -> {
            Optional<PostpaidUser> existing = findPostpaid(user.getUsername());

            if (existing.isEmpty()) {
                if (user.getId() != null) {
                    throw new ConflictException(
                        "Postpaid user " + user.getId() + " cannot be renamed to " + user.getUsername());
                }
                Long id;
                try {
                    id = jdbcTemplate.queryForObject(
                        "INSERT INTO users_postpaid (username, money, activated, last_drink) " +
                        "VALUES (?, ?, ?, ?) RETURNING id",
                        Long.class,
                        user.getUsername(),
                        user.getMoney(),
                        user.isActivated(),
                        toTimestamp(user.getLastDrink())
                    );
                } catch (DuplicateKeyException e) {
                    // Lost a race with a concurrent insert of the same username
                    throw new ConflictException("Username already taken: " + user.getUsername());
                } catch (DataIntegrityViolationException e) {
                    throw invalidRecord("postpaid user " + user.getUsername(), e);
                }
                log.debug("Inserted postpaid user {} with id {}", user.getUsername(), id);
                return user.withId(id);
            }

            Long existingId = existing.get().getId();
            if (user.getId() != null && !user.getId().equals(existingId)) {
                throw new ConflictException("Username already taken: " + user.getUsername());
            }
            jdbcTemplate.update(
                "UPDATE users_postpaid SET money = ?, activated = ?, last_drink = ? WHERE id = ?",
                user.getMoney(),
                user.isActivated(),
                toTimestamp(user.getLastDrink()),
                existingId
            );
            return user.withId(existingId);
        });
    }

    @Override
    public Optional<PrepaidUser> findPrepaid(String username) {
        return guard(() -> queryOptional(
            "SELECT " + PREPAID_COLUMNS + " FROM users_prepaid WHERE username = ?" + lockClause(),
            prepaidRowMapper(), username));
    }

    @Override
    public Optional<PrepaidUser> findPrepaidByKey(String userKey) {
        return guard(() -> queryOptional(
            "SELECT " + PREPAID_COLUMNS + " FROM users_prepaid WHERE user_key = ?" + lockClause(),
            prepaidRowMapper(), userKey));
    }

    @Override
    public List<PrepaidUser> listPrepaidByOwner(long postpaidUserId) {
        return guard(() -> jdbcTemplate.query(
            "SELECT " + PREPAID_COLUMNS + " FROM users_prepaid WHERE postpaid_user_id = ? ORDER BY id",
            prepaidRowMapper(), postpaidUserId));
    }

    @Override
    public List<PrepaidUser> listPrepaid() {
        return guard(() -> jdbcTemplate.query(
            "SELECT " + PREPAID_COLUMNS + " FROM users_prepaid ORDER BY id",
            prepaidRowMapper()));
    }

    @Override
    public PrepaidUser upsertPrepaid(PrepaidUser user) {
        return inTransaction(() -> {
            Optional<PrepaidUser> existing = findPrepaid(user.getUsername());

            if (existing.isPresent() && user.getId() != null && !user.getId().equals(existing.get().getId())) {
                throw new ConflictException("Username already taken: " + user.getUsername());
            }
            if (existing.isEmpty() && user.getId() != null) {
                throw new ConflictException(
                    "Prepaid user " + user.getId() + " cannot be renamed to " + user.getUsername());
            }
            if (isRetired(user.getUserKey())) {
                throw new ConflictException("User key has been retired");
            }

            try {
                if (existing.isEmpty()) {
                    Long id = jdbcTemplate.queryForObject(
                        "INSERT INTO users_prepaid (username, user_key, postpaid_user_id, money, activated, last_drink) " +
                        "VALUES (?, ?, ?, ?, ?, ?) RETURNING id",
                        Long.class,
                        user.getUsername(),
                        user.getUserKey(),
                        user.getPostpaidUserId(),
                        user.getMoney(),
                        user.isActivated(),
                        toTimestamp(user.getLastDrink())
                    );
                    log.debug("Inserted prepaid user {} with id {}", user.getUsername(), id);
                    return user.withId(id);
                }

                Long existingId = existing.get().getId();
                jdbcTemplate.update(
                    "UPDATE users_prepaid SET user_key = ?, postpaid_user_id = ?, money = ?, activated = ?, " +
                    "last_drink = ? WHERE id = ?",
                    user.getUserKey(),
                    user.getPostpaidUserId(),
                    user.getMoney(),
                    user.isActivated(),
                    toTimestamp(user.getLastDrink()),
                    existingId
                );
                return user.withId(existingId);
            } catch (DuplicateKeyException e) {
                throw new ConflictException("User key already in use");
            } catch (DataIntegrityViolationException e) {
                if (FOREIGN_KEY_VIOLATION.equals(sqlState(e))) {
                    throw new NotFoundException("Owning postpaid user not found: " + user.getPostpaidUserId());
                }
                throw invalidRecord("prepaid user " + user.getUsername(), e);
            }
        });
    }

    @Override
    public void deletePrepaid(String username) {
        runInTransaction(() -> {
            PrepaidUser existing = findPrepaid(username)
                .orElseThrow(() -> new NotFoundException("Prepaid user not found: " + username));

            jdbcTemplate.update("DELETE FROM users_prepaid WHERE id = ?", existing.getId());
            jdbcTemplate.update(
                "INSERT INTO retired_user_keys (user_key, retired_at) VALUES (?, CURRENT_TIMESTAMP)",
                existing.getUserKey()
            );
            log.debug("Deleted prepaid user {} and retired its key", username);
        });
    }

    @Override
    public boolean isUserKeyTaken(String userKey) {
        return guard(() -> {
            Integer count = jdbcTemplate.queryForObject(
                "SELECT (SELECT COUNT(*) FROM users_prepaid WHERE user_key = ?) " +
                "+ (SELECT COUNT(*) FROM retired_user_keys WHERE user_key = ?)",
                Integer.class,
                userKey,
                userKey
            );
            return count != null && count > 0;
        });
    }

    @Override
    public List<DrinkType> listDrinkTypes() {
        return guard(() -> jdbcTemplate.query(
            "SELECT " + DRINK_TYPE_COLUMNS + " FROM drink_types ORDER BY id",
            drinkTypeRowMapper()));
    }

    @Override
    public Optional<DrinkType> findDrinkType(int id) {
        return guard(() -> queryOptional(
            "SELECT " + DRINK_TYPE_COLUMNS + " FROM drink_types WHERE id = ?" + lockClause(),
            drinkTypeRowMapper(), id));
    }

    @Override
    public DrinkType insertDrinkType(String name, String icon, int quantity) {
        return inTransaction(() -> {
            try {
                Integer id = jdbcTemplate.queryForObject(
                    "INSERT INTO drink_types (drink_name, icon, quantity, consumed) VALUES (?, ?, ?, 0) RETURNING id",
                    Integer.class,
                    name,
                    icon,
                    quantity
                );
                return new DrinkType(id, name, icon, quantity, 0L);
            } catch (DuplicateKeyException e) {
                throw new ConflictException("Drink type already exists: " + name);
            }
        });
    }

    @Override
    public DrinkType updateDrinkType(DrinkType drinkType) {
        return inTransaction(() -> {
            int updated = jdbcTemplate.update(
                "UPDATE drink_types SET icon = ?, quantity = ?, consumed = ? WHERE id = ? AND drink_name = ?",
                drinkType.getIcon(),
                drinkType.getQuantity(),
                drinkType.getConsumed(),
                drinkType.getId(),
                drinkType.getName()
            );
            if (updated == 0) {
                throw new NotFoundException("Drink type not found: " + drinkType.getId());
            }
            return drinkType;
        });
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return guard(() -> transactionTemplate.execute(status -> work.get()));
    }

    @Override
    public boolean isAvailable() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (Exception e) {
            log.warn("Ledger store availability check failed: {}", e.getMessage());
            return false;
        }
    }

    private boolean isRetired(String userKey) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM retired_user_keys WHERE user_key = ?",
            Integer.class,
            userKey
        );
        return count != null && count > 0;
    }

    private static String sqlState(DataIntegrityViolationException e) {
        Throwable cause = e.getMostSpecificCause();
        return cause instanceof SQLException sqlException ? sqlException.getSQLState() : null;
    }

    private static IllegalArgumentException invalidRecord(String what, DataIntegrityViolationException e) {
        log.warn("Rejected {} (SQLState {}): {}", what, sqlState(e), e.getMostSpecificCause().getMessage());
        return new IllegalArgumentException("Invalid " + what + ": " + e.getMostSpecificCause().getMessage());
    }

    private <T> Optional<T> queryOptional(String sql, RowMapper<T> rowMapper, Object... args) {
        List<T> rows = jdbcTemplate.query(sql, rowMapper, args);
        return rows.stream().findFirst();
    }

    private String lockClause() {
        return TransactionSynchronizationManager.isActualTransactionActive() ? " FOR UPDATE" : "";
    }

    private <T> T guard(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessResourceException
                 | CannotCreateTransactionException e) {
            throw new StoreUnavailableException("Ledger store unreachable", e);
        }
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private RowMapper<PostpaidUser> postpaidRowMapper() {
        return (rs, rowNum) -> new PostpaidUser(
            rs.getLong("id"),
            rs.getString("username"),
            rs.getLong("money"),
            rs.getBoolean("activated"),
            toInstant(rs, "last_drink")
        );
    }

    private RowMapper<PrepaidUser> prepaidRowMapper() {
        return (rs, rowNum) -> new PrepaidUser(
            rs.getLong("id"),
            rs.getString("username"),
            rs.getString("user_key"),
            rs.getLong("postpaid_user_id"),
            rs.getLong("money"),
            rs.getBoolean("activated"),
            toInstant(rs, "last_drink")
        );
    }

    private RowMapper<DrinkType> drinkTypeRowMapper() {
        return (rs, rowNum) -> new DrinkType(
            rs.getInt("id"),
            rs.getString("drink_name"),
            rs.getString("icon"),
            rs.getInt("quantity"),
            rs.getLong("consumed")
        );
    }
}
