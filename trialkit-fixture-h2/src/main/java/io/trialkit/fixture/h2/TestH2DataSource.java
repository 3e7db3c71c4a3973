/*
 * Copyright 2015-2025 Endre Stølsvik
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.trialkit.fixture.h2;

import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Logger;

import javax.sql.DataSource;

import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.LoggerFactory;

/**
 * A wrapped H2 DataSource with a couple of extra methods which simplify integration-style test units, in particular
 * {@link #cleanDatabase()}, {@link #shutdown()} and the "datatable" convenience methods for storing and reading simple
 * values.
 */
public class TestH2DataSource implements DataSource {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(TestH2DataSource.class);
    private static final String LOG_PREFIX = "#TRIALKIT# ";

    /**
     * System property ("-D" jvm argument) that if set will change the method {@link #createStandard()} from returning
     * an in-memory H2 DataSource, to instead return a DataSource using the URL from the value, with the special case
     * that if the value is "{@link #SYSPROP_VALUE_FILE_BASED file}", it will be
     * {@link #FILE_BASED_TEST_H2_DATABASE_URL}.
     * <p>
     * Value is {@code "trialkit.test.h2"}
     */
    public static final String SYSPROP_TRIALKIT_TEST_H2 = "trialkit.test.h2";

    /**
     * If the value of {@link #SYSPROP_TRIALKIT_TEST_H2} is this value, {@link #createStandard()} uses the URL
     * {@link #FILE_BASED_TEST_H2_DATABASE_URL}.
     * <p>
     * Value is {@code "file"}
     */
    public static final String SYSPROP_VALUE_FILE_BASED = "file";

    public static final String FILE_BASED_TEST_H2_DATABASE_URL = "jdbc:h2:./trialkitTestH2DB;AUTO_SERVER=TRUE";
    public static final String IN_MEMORY_TEST_H2_DATABASE_URL = "jdbc:h2:mem:trialkitTestH2DB_$random$;DB_CLOSE_DELAY=-1";

    /**
     * Creates a unique in-memory {@link TestH2DataSource}, <b>unless</b> the System Property
     * {@link #SYSPROP_TRIALKIT_TEST_H2} (<code>"trialkit.test.h2"</code>) is set to a URL to use instead, with the
     * special case {@link #SYSPROP_VALUE_FILE_BASED} (<code>"file"</code>) meaning
     * {@link #FILE_BASED_TEST_H2_DATABASE_URL}.
     * <p>
     * <b>Notice that {@link #cleanDatabase()} is invoked when creating the DataSource, which is relevant when using
     * the file-based variant.</b>
     */
    public static TestH2DataSource createStandard() {
        String sysprop = System.getProperty(SYSPROP_TRIALKIT_TEST_H2);
        // ?: Was it set?
        if (sysprop == null) {
            // -> No, not set - so return normal in-memory database
            return createInMemoryRandom();
        }
        // E-> The System Property was set. ?: Was it the special "file" value?
        if (sysprop.equalsIgnoreCase(SYSPROP_VALUE_FILE_BASED)) {
            // -> Yes, special "file" value
            return create(FILE_BASED_TEST_H2_DATABASE_URL);
        }
        // E-> No, not special value, so treat it as a URL directly
        return create(sysprop);
    }

    /**
     * Creates a {@link TestH2DataSource} on a fresh, randomly named in-memory database.
     */
    public static TestH2DataSource createInMemoryRandom() {
        return create(IN_MEMORY_TEST_H2_DATABASE_URL
                .replace("$random$", Long.toString(Math.abs(ThreadLocalRandom.current().nextLong()), 36)));
    }

    /**
     * Creates a {@link TestH2DataSource} using the supplied URL, and cleans the database.
     */
    public static TestH2DataSource create(String url) {
        log.info(LOG_PREFIX + "Creating TestH2DataSource with URL [" + url + "].");
        TestH2DataSource dataSource = new TestH2DataSource(url);
        dataSource.cleanDatabase();
        return dataSource;
    }

    private final JdbcDataSource _wrappedH2JdbcDataSource;

    private TestH2DataSource(String url) {
        _wrappedH2JdbcDataSource = new JdbcDataSource();
        _wrappedH2JdbcDataSource.setURL(url);
    }

    public String getUrl() {
        return _wrappedH2JdbcDataSource.getUrl();
    }

    /**
     * @return whether this is a private in-memory database, i.e. created by {@link #createInMemoryRandom()}.
     */
    public boolean isInMemoryRandom() {
        return getUrl().contains(":mem:trialkitTestH2DB_");
    }

    /**
     * Cleans the test database: Runs SQL <code>"DROP ALL OBJECTS DELETE FILES"</code>.
     */
    public void cleanDatabase() {
        execute("DROP ALL OBJECTS DELETE FILES");
    }

    /**
     * Shuts the database down, runs SQL <code>"SHUTDOWN"</code>. Only for private in-memory databases: a shared or
     * file-based database is just {@link #cleanDatabase() cleaned}.
     */
    public void shutdown() {
        if (!isInMemoryRandom()) {
            log.info(LOG_PREFIX + "Not shutting down non-private TestH2DataSource [" + getUrl()
                    + "], only cleaning it.");
            cleanDatabase();
            return;
        }
        log.info(LOG_PREFIX + "Shutting down in-mem random TestH2DataSource [" + getUrl() + "].");
        execute("SHUTDOWN");
    }

    /**
     * Runs one SQL statement on a fresh Connection.
     */
    public void execute(String sql) {
        try (Connection con = getConnection();
                Statement stmt = con.createStatement()) {
            stmt.execute(sql);
        }
        catch (SQLException e) {
            throw new TestH2DataSourceException("Got problems running '" + sql + "'.", e);
        }
    }

    /**
     * Creates a test "datatable": <code>"CREATE TABLE datatable (data VARCHAR NOT NULL, CONSTRAINT UC_data UNIQUE
     * (data))"</code>.
     */
    public void createDataTable() {
        execute("CREATE TABLE datatable (data VARCHAR NOT NULL, CONSTRAINT UC_data UNIQUE (data))");
    }

    /**
     * Inserts the provided 'data' into the SQL Table 'datatable'.
     */
    public void insertDataIntoDataTable(String data) {
        try (Connection con = getConnection();
                PreparedStatement pStmt = con.prepareStatement("INSERT INTO datatable VALUES (?)")) {
            pStmt.setString(1, data);
            pStmt.execute();
        }
        catch (SQLException e) {
            throw new TestH2DataSourceException("Got problems inserting into SQL Table 'datatable'.", e);
        }
    }

    /**
     * @return all rows in the 'datatable', SQL <code>"SELECT data FROM datatable ORDER BY data"</code>.
     */
    public List<String> getDataFromDataTable() {
        try (Connection con = getConnection();
                Statement stmt = con.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT data FROM datatable ORDER BY data")) {
            List<String> ret = new ArrayList<>();
            while (rs.next()) {
                ret.add(rs.getString(1));
            }
            return ret;
        }
        catch (SQLException e) {
            throw new TestH2DataSourceException("Got problems fetching column 'data' from SQL Table 'datatable'.", e);
        }
    }

    /**
     * A {@link RuntimeException} for database access problems in the convenience methods.
     */
    public static class TestH2DataSourceException extends RuntimeException {
        public TestH2DataSourceException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    // =================================================================================================
    // ======= Implementation of DataSource, forwarding to H2's JdbcDataSource
    // =================================================================================================

    @Override
    public Connection getConnection() throws SQLException {
        return _wrappedH2JdbcDataSource.getConnection();
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        return _wrappedH2JdbcDataSource.getConnection(username, password);
    }

    @Override
    public PrintWriter getLogWriter() throws SQLException {
        return _wrappedH2JdbcDataSource.getLogWriter();
    }

    @Override
    public void setLogWriter(PrintWriter out) throws SQLException {
        _wrappedH2JdbcDataSource.setLogWriter(out);
    }

    @Override
    public void setLoginTimeout(int seconds) throws SQLException {
        _wrappedH2JdbcDataSource.setLoginTimeout(seconds);
    }

    @Override
    public int getLoginTimeout() throws SQLException {
        return _wrappedH2JdbcDataSource.getLoginTimeout();
    }

    @Override
    public Logger getParentLogger() throws SQLFeatureNotSupportedException {
        return _wrappedH2JdbcDataSource.getParentLogger();
    }

    @Override
    public <T> T unwrap(Class<T> iface) throws SQLException {
        if (iface.isInstance(this)) {
            return iface.cast(this);
        }
        return _wrappedH2JdbcDataSource.unwrap(iface);
    }

    @Override
    public boolean isWrapperFor(Class<?> iface) throws SQLException {
        return iface.isInstance(this) || _wrappedH2JdbcDataSource.isWrapperFor(iface);
    }

    @Override
    public String toString() {
        return "TestH2DataSource[" + getUrl() + "]";
    }
}
