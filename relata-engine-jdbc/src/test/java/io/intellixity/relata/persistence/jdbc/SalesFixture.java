package io.intellixity.relata.persistence.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.relata.persistence.config.RelataConfig;
import io.intellixity.relata.persistence.config.RelataConfigLoader;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/** In-memory H2 sales schema shared by the JDBC engine tests. */
public final class SalesFixture {
  public record Invoice(int id, int customerId, int productId, int categoryId, BigDecimal amount, String status) {}

  public static final List<Invoice> INVOICES = List.of(
      new Invoice(1, 1, 1, 1, new BigDecimal("50.00"), "paid"),
      new Invoice(2, 1, 2, 1, new BigDecimal("150.00"), "open"),
      new Invoice(3, 2, 3, 2, new BigDecimal("101.00"), "paid"),
      new Invoice(4, 2, 1, 1, new BigDecimal("100.00"), "void"),
      new Invoice(5, 3, 2, 1, new BigDecimal("250.50"), "paid"),
      new Invoice(6, 3, 3, 2, new BigDecimal("20.00"), "open"));

  /** Region of customers 1..3. */
  public static final List<String> REGIONS = List.of("North", "South", "North");

  public static final String CONFIG = """
      hub: invoices
      relations:
        - { from: customers, to: invoices, localKey: id, foreignKey: customer_id }
        - { from: products, to: invoices, localKey: id, foreignKey: product_id }
        - { from: categories, to: products, localKey: id, foreignKey: category_id }
        - { from: categories, to: invoices, localKey: id, foreignKey: category_id }
      references:
        - { keyField: customer_id, entity: customers, idField: id, extraFields: { region: customer_region, zone: customer_zone } }
        - { keyField: product_id, entity: products, idField: id }
        - { keyField: category_id, entity: categories, idField: id }
      """;

  private SalesFixture() {}

  public static RelataConfig config() {
    return RelataConfigLoader.fromYaml(CONFIG);
  }

  /** Pooled data source over a fresh in-memory database; pass any H2 compatibility options in {@code urlOptions}. */
  public static HikariDataSource dataSource(String dbName, String urlOptions) throws SQLException {
    HikariConfig cfg = new HikariConfig();
    cfg.setJdbcUrl("jdbc:h2:mem:" + dbName + ";DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE" + urlOptions);
    cfg.setMaximumPoolSize(4);
    cfg.setPoolName("relata-" + dbName);
    HikariDataSource ds = new HikariDataSource(cfg);
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      st.execute("CREATE TABLE customers (id INT PRIMARY KEY, name VARCHAR(64), region VARCHAR(32), zone VARCHAR(8))");
      st.execute("CREATE TABLE categories (id INT PRIMARY KEY, name VARCHAR(64))");
      st.execute("CREATE TABLE products (id INT PRIMARY KEY, title VARCHAR(64), category_id INT)");
      st.execute("CREATE TABLE invoices (id INT PRIMARY KEY, customer_id INT, product_id INT, category_id INT,"
          + " amount DECIMAL(10,2), status VARCHAR(16))");
      st.execute("CREATE TABLE flags (id INT PRIMARY KEY, a INT, b INT)");

      st.execute("INSERT INTO customers VALUES (1, 'Acme', 'North', 'N1'), (2, 'Globex', 'South', NULL), (3, '50% Club', 'North', 'N2')");
      st.execute("INSERT INTO categories VALUES (1, 'Furniture'), (2, 'Office')");
      st.execute("INSERT INTO products VALUES (1, 'Chair', 1), (2, 'Desk', 1), (3, 'Pen', 2)");
      for (Invoice i : INVOICES) {
        st.execute("INSERT INTO invoices VALUES (" + i.id() + ", " + i.customerId() + ", " + i.productId() + ", "
            + i.categoryId() + ", " + i.amount().toPlainString() + ", '" + i.status() + "')");
      }
      int id = 1;
      for (int[] ab : flagRows()) {
        st.execute("INSERT INTO flags VALUES (" + (id++) + ", " + ab[0] + ", " + ab[1] + ")");
      }
    }
    return ds;
  }

  /** Every (a, b) with a in 0..2 and b in 1..4, ids assigned in this order starting at 1. */
  public static List<int[]> flagRows() {
    List<int[]> out = new ArrayList<>();
    for (int a = 0; a <= 2; a++)
      for (int b = 1; b <= 4; b++) out.add(new int[] {a, b});
    return out;
  }
}
