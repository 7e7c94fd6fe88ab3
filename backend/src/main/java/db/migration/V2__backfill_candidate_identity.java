package db.migration;

import com.delta.vms.vendor.util.IdentityNormalizer;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/**
 * Fills normalized identity columns of candidates imported with raw values only. A value that
 * would collide with another candidate of the same tenant stays null.
 */
public class V2__backfill_candidate_identity extends BaseJavaMigration {
  private static final String DEFAULT_CALLING_CODE = "31";

  @Override
  public void migrate(Context context) throws Exception {
    Connection connection = context.getConnection();
    List<Row> rows = new ArrayList<>();
    String select =
        "SELECT id, tenant_id, email, phone, linkedin_url, first_name, last_name, "
            + "normalized_email, normalized_phone, normalized_linkedin, normalized_name "
            + "FROM candidates "
            + "WHERE (normalized_email IS NULL AND email IS NOT NULL) "
            + "OR (normalized_phone IS NULL AND phone IS NOT NULL) "
            + "OR (normalized_linkedin IS NULL AND linkedin_url IS NOT NULL) "
            + "OR (normalized_name IS NULL AND (first_name IS NOT NULL OR last_name IS NOT NULL))";
    try (PreparedStatement ps = connection.prepareStatement(select);
        ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        rows.add(
            new Row(
                rs.getLong("id"),
                rs.getString("tenant_id"),
                firstNonNull(
                    rs.getString("normalized_email"),
                    IdentityNormalizer.normalizeEmail(rs.getString("email"))),
                firstNonNull(
                    rs.getString("normalized_phone"),
                    IdentityNormalizer.normalizePhone(rs.getString("phone"), DEFAULT_CALLING_CODE)),
                firstNonNull(
                    rs.getString("normalized_linkedin"),
                    IdentityNormalizer.normalizeLinkedinUrl(rs.getString("linkedin_url"))),
                firstNonNull(
                    rs.getString("normalized_name"),
                    IdentityNormalizer.normalizeName(
                        rs.getString("first_name"), rs.getString("last_name")))));
      }
    }

    String update =
        "UPDATE candidates SET normalized_email = ?, normalized_phone = ?, "
            + "normalized_linkedin = ?, normalized_name = ? WHERE id = ?";
    Set<String> claimed = new HashSet<>();
    try (PreparedStatement ps = connection.prepareStatement(update)) {
      for (Row row : rows) {
        ps.setString(1, unique(connection, claimed, row, "normalized_email", row.email()));
        ps.setString(2, unique(connection, claimed, row, "normalized_phone", row.phone()));
        ps.setString(3, unique(connection, claimed, row, "normalized_linkedin", row.linkedin()));
        ps.setString(4, row.name());
        ps.setLong(5, row.id());
        ps.addBatch();
      }
      ps.executeBatch();
    }
  }

  private String unique(
      Connection connection, Set<String> claimed, Row row, String column, String value)
      throws SQLException {
    if (value == null) {
      return null;
    }
    if (!claimed.add(row.tenantId() + "|" + column + "|" + value)) {
      return null;
    }
    String sql =
        "SELECT 1 FROM candidates WHERE tenant_id = ? AND " + column + " = ? AND id <> ?";
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      ps.setString(1, row.tenantId());
      ps.setString(2, value);
      ps.setLong(3, row.id());
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? null : value;
      }
    }
  }

  private static String firstNonNull(String current, String computed) {
    return current != null ? current : computed;
  }

  private record Row(
      long id, String tenantId, String email, String phone, String linkedin, String name) {}
}
