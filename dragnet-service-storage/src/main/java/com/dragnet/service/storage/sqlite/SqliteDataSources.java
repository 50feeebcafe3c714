package com.dragnet.service.storage.sqlite;

import java.nio.file.Path;
import javax.sql.DataSource;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/** JDBC data sources over SQLite index files. */
public final class SqliteDataSources {

    private static final String DRIVER = "org.sqlite.JDBC";

    private SqliteDataSources() {}

    public static String url(Path file) {
        return "jdbc:sqlite:" + file.toAbsolutePath();
    }

    /** One connection held open until {@link SingleConnectionDataSource#destroy()}; used by a single writer. */
    public static SingleConnectionDataSource writable(Path file) {
        SingleConnectionDataSource dataSource = new SingleConnectionDataSource(url(file), true);
        dataSource.setDriverClassName(DRIVER);
        return dataSource;
    }

    /** Opens a fresh read-only connection per use, so it can be shared by concurrent queries. */
    public static DataSource readOnly(Path file) {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl(url(file));
        return dataSource;
    }
}
