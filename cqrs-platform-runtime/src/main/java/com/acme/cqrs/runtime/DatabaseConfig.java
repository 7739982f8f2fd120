package com.acme.cqrs.runtime;

/** Connection settings of the JDBC stores, bound from {@code db.*}. */
public class DatabaseConfig {

  private String dialect;
  private String url;
  private String username = "";
  private String password = "";
  private int maximumPoolSize = 10;
  private boolean migrate = true;

  public String getDialect() {
    return dialect;
  }

  public void setDialect(String dialect) {
    this.dialect = dialect;
  }

  public String getUrl() {
    return url;
  }

  public void setUrl(String url) {
    this.url = url;
  }

  public String getUsername() {
    return username;
  }

  public void setUsername(String username) {
    this.username = username;
  }

  public String getPassword() {
    return password;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  public int getMaximumPoolSize() {
    return maximumPoolSize;
  }

  public void setMaximumPoolSize(int maximumPoolSize) {
    this.maximumPoolSize = maximumPoolSize;
  }

  public boolean isMigrate() {
    return migrate;
  }

  public void setMigrate(boolean migrate) {
    this.migrate = migrate;
  }

  /** Flyway location holding the scripts of the configured dialect. */
  public String migrationLocation() {
    if ("H2".equalsIgnoreCase(dialect)) {
      return "classpath:db/migration/h2";
    }
    if ("POSTGRES".equalsIgnoreCase(dialect)) {
      return "classpath:db/migration/postgres";
    }
    throw new IllegalStateException("Unsupported db.dialect: " + dialect);
  }

  @Override
  public String toString() {
    return "DatabaseConfig{dialect="
        + dialect
        + ", url="
        + url
        + ", username="
        + username
        + ", maximumPoolSize="
        + maximumPoolSize
        + ", migrate="
        + migrate
        + '}';
  }
}
