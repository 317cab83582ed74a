package com.sqlopt.optimizer.config;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.ToString;

/**
 * Connection settings for the Trino cluster. The catalog and schema are also the defaults used
 * for unqualified table references.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "trino")
public class TrinoProperties {

  @NotBlank private String host = "localhost";

  @Min(1)
  @Max(65535)
  private int port = 443;

  @NotBlank private String user = "sql-optimizer";

  @NotBlank private String catalog = "hive";

  @NotBlank private String schema = "default";

  @NotBlank private String httpScheme = "https";

  private String source = "sql-optimizer";

  private Map<String, String> sessionProperties = new LinkedHashMap<>();

  private String basicUser;

  @ToString.Exclude private String basicPassword;

  /** Applied as the JDBC query timeout; 0 disables it. */
  @Min(0)
  private int queryTimeoutSeconds = 60;

  public boolean isSsl() {
    return "https".equalsIgnoreCase(httpScheme);
  }

  public boolean hasBasicAuth() {
    return basicUser != null
        && !basicUser.isBlank()
        && basicPassword != null
        && !basicPassword.isEmpty();
  }
}
