package com.kid.jdbc;

import com.kid.InvalidKidException;
import com.kid.Kid;

import java.nio.charset.StandardCharsets;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

/**
 * JDBC binding for kids stored in a text column.
 *
 * Kids are stored as their 16-character encoding. {@link Kid#NIL} is bound as
 * SQL NULL and SQL NULL reads back as {@link Kid#NIL}.
 */
public final class KidJdbc {

    private KidJdbc() {}

    /**
     * Binds {@code kid} to parameter {@code index}; nil or null become SQL NULL.
     */
    public static void bind(PreparedStatement statement, int index, Kid kid) throws SQLException {
        if (kid == null || kid.isNil()) {
            statement.setNull(index, Types.VARCHAR);
            return;
        }
        statement.setString(index, kid.toString());
    }

    public static Kid read(ResultSet resultSet, String column) throws SQLException {
        return fromColumnValue(resultSet.getObject(column));
    }

    public static Kid read(ResultSet resultSet, int column) throws SQLException {
        return fromColumnValue(resultSet.getObject(column));
    }

    /**
     * Converts a raw column value. Binary values are read as encoded text,
     * not as the 10 raw bytes.
     *
     * @throws SQLException for unsupported column types or invalid text
     */
    static Kid fromColumnValue(Object value) throws SQLException {
        if (value == null) {
            return Kid.NIL;
        }
        if (value instanceof String) {
            return decode((String) value);
        }
        if (value instanceof byte[]) {
            return decode(new String((byte[]) value, StandardCharsets.US_ASCII));
        }
        throw new SQLException("kid: scanning unsupported type: " + value.getClass().getName());
    }

    private static Kid decode(String text) throws SQLException {
        try {
            return Kid.fromString(text);
        } catch (InvalidKidException e) {
            throw new SQLException(e.getMessage(), e);
        }
    }
}
