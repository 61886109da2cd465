package tech.yump.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;
import tech.yump.gateway.config.GatewayProperties;

@Slf4j
@SpringBootApplication(
        exclude = { DataSourceAutoConfiguration.class }
)
@EnableConfigurationProperties(GatewayProperties.class)
@EnableScheduling
public class SecretsGatewayApplication {

  public static void main(String[] args) {
    SpringApplication.run(SecretsGatewayApplication.class, args);
    log.info(">>> Secrets Gateway Started <<<");
  }
}
