package org.gudu0.journalbot.store;

import java.sql.Connection;
import java.sql.SQLException;

@FunctionalInterface
public interface SqlWork<T> {
    T run(Connection conn) throws SQLException;
}
