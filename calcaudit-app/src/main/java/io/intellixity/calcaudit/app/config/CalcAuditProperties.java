package io.intellixity.calcaudit.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "calcaudit")
public class CalcAuditProperties {
  private final Db db = new Db();
  private final Review review = new Review();
  private final Audit audit = new Audit();

  public Db getDb() { return db; }
  public Review getReview() { return review; }
  public Audit getAudit() { return audit; }

  public static class Db {
    private String jdbcUrl;
    private String username;
    private String password;
    private String schema = "public";
    private int maximumPoolSize = 10;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  }

  public static class Review {
    /** JSON-lines file of review entries. */
    private String file = "reviewed_items.txt";

    public String getFile() { return file; }
    public void setFile(String file) { this.file = file; }
  }

  public static class Audit {
    /** Funds audited concurrently by the all-funds audit. */
    private int parallelism = 4;

    public int getParallelism() { return parallelism; }
    public void setParallelism(int parallelism) { this.parallelism = parallelism; }
  }
}
