/*
 * Where: Relay schema migrations
 * What: Adds notifications.seen_at when the column is missing
 * Why: Stores baselined from older deployments may or may not already carry the column
 */
package db.migration;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public class V2__Add_seen_at_column extends BaseJavaMigration {

  static final String TABLE = "notifications";
  static final String COLUMN = "seen_at";

  @Override
  public void migrate(Context context) throws SQLException {
    final Connection connection = context.getConnection();
    if (hasColumn(connection)) {
      return;
    }
    try (Statement statement = connection.createStatement()) {
      statement.execute("ALTER TABLE " + TABLE + " ADD COLUMN " + COLUMN + " DATETIME");
    }
  }

  private boolean hasColumn(Connection connection) throws SQLException {
    try (Statement statement = connection.createStatement();
        ResultSet columns = statement.executeQuery("PRAGMA table_info(" + TABLE + ")")) {
      while (columns.next()) {
        if (COLUMN.equalsIgnoreCase(columns.getString("name"))) {
          return true;
        }
      }
      return false;
    }
  }
}
