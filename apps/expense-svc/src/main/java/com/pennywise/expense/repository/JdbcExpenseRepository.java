package com.pennywise.expense.repository;

import com.pennywise.expense.error.ExpenseStorageException;
import com.pennywise.expense.model.AnalyticsRow;
import com.pennywise.expense.model.Expense;
import com.pennywise.expense.model.NewExpense;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Optional;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcExpenseRepository implements ExpenseRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcExpenseRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long insert(NewExpense expense) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("amount", expense.amount())
                .addValue("category", expense.category())
                .addValue("expenseDate", Date.valueOf(expense.expenseDate()))
                .addValue("note", expense.note().orElse(null), Types.VARCHAR);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update("""
                    INSERT INTO expenses (amount, category, expense_date, note)
                    VALUES (:amount, :category, :expenseDate, :note)
                    """, params, keyHolder, new String[]{"id"});
        } catch (DataAccessException ex) {
            throw storageFailure(ex);
        }
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new ExpenseStorageException("Insert did not return a generated id", null);
        }
        return key.longValue();
    }

    @Override
    public Optional<Long> deleteById(long id) {
        try {
            int deleted = jdbcTemplate.update("DELETE FROM expenses WHERE id = :id",
                    new MapSqlParameterSource("id", id));
            return deleted > 0 ? Optional.of(id) : Optional.empty();
        } catch (DataAccessException ex) {
            throw storageFailure(ex);
        }
    }

    @Override
    public List<Expense> listRecent(int limit) {
        try {
            return jdbcTemplate.query("""
                    SELECT id, amount, category, expense_date, note, created_at
                    FROM expenses
                    ORDER BY created_at DESC, id DESC
                    LIMIT :limit
                    """, new MapSqlParameterSource("limit", limit), this::mapExpense);
        } catch (DataAccessException ex) {
            throw storageFailure(ex);
        }
    }

    @Override
    public List<AnalyticsRow> listAllForAnalytics() {
        try {
            return jdbcTemplate.query("""
                    SELECT amount, category, expense_date
                    FROM expenses
                    ORDER BY id
                    """, new MapSqlParameterSource(), (rs, rowNum) -> new AnalyticsRow(
                    rs.getDouble("amount"),
                    rs.getString("category"),
                    rs.getString("expense_date")));
        } catch (DataAccessException ex) {
            throw storageFailure(ex);
        }
    }

    private Expense mapExpense(ResultSet rs, int rowNum) throws SQLException {
        return new Expense(
                rs.getLong("id"),
                rs.getBigDecimal("amount"),
                rs.getString("category"),
                rs.getDate("expense_date").toLocalDate(),
                Optional.ofNullable(rs.getString("note")),
                rs.getTimestamp("created_at").toLocalDateTime()
        );
    }

    private ExpenseStorageException storageFailure(DataAccessException ex) {
        Throwable cause = ex.getMostSpecificCause();
        String message = cause.getMessage() != null ? cause.getMessage() : ex.getMessage();
        return new ExpenseStorageException(message, ex);
    }
}
