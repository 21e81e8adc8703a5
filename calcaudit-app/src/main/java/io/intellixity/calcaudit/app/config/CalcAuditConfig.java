package io.intellixity.calcaudit.app.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.calcaudit.audit.KeyRecordSource;
import io.intellixity.calcaudit.catalog.MetadataCatalog;
import io.intellixity.calcaudit.jdbc.JdbcHandle;
import io.intellixity.calcaudit.jdbc.JdbcKeyRecordSource;
import io.intellixity.calcaudit.jdbc.JdbcMetadataCatalog;
import io.intellixity.calcaudit.review.ReviewLog;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(CalcAuditProperties.class)
public class CalcAuditConfig {

  @Bean(destroyMethod = "close")
  public HikariDataSource metadataDataSource(CalcAuditProperties props) {
    CalcAuditProperties.Db db = props.getDb();
    if (db.getJdbcUrl() == null || db.getJdbcUrl().isBlank()) {
      throw new IllegalArgumentException("Missing calcaudit.db.jdbc-url");
    }
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(db.getJdbcUrl());
    hc.setUsername(db.getUsername());
    hc.setPassword(db.getPassword());
    hc.setMaximumPoolSize(db.getMaximumPoolSize());
    hc.setReadOnly(true);
    hc.setPoolName("calcaudit-metadata");
    // connect lazily so the service starts even when the database is down; audits then fail with 503
    hc.setInitializationFailTimeout(-1);
    return new HikariDataSource(hc);
  }

  @Bean
  public JdbcHandle metadataHandle(HikariDataSource metadataDataSource, CalcAuditProperties props) {
    return new JdbcHandle("jdbc:metadata", metadataDataSource, props.getDb().getSchema());
  }

  @Bean
  public KeyRecordSource keyRecordSource(JdbcHandle metadataHandle) {
    return new JdbcKeyRecordSource(metadataHandle);
  }

  @Bean
  public MetadataCatalog metadataCatalog(JdbcHandle metadataHandle) {
    return new JdbcMetadataCatalog(metadataHandle);
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService auditExecutor(CalcAuditProperties props) {
    return Executors.newFixedThreadPool(Math.max(1, props.getAudit().getParallelism()));
  }

  @Bean
  public ReviewLog reviewLog(CalcAuditProperties props) {
    return new ReviewLog(Path.of(props.getReview().getFile()));
  }
}
