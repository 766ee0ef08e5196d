package com.age.mcp.graph;

import java.sql.SQLException;

/**
 * Body of a scoped transaction.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface TransactionCallback<T> {

    T doInTransaction(GraphSession session) throws SQLException;
}
