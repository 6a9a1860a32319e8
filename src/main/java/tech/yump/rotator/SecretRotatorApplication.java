package tech.yump.rotator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.rotator.config.RotatorProperties;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(RotatorProperties.class)
public class SecretRotatorApplication {

  public static void main(String[] args) {
    SpringApplication.run(SecretRotatorApplication.class, args);
    log.info(">>> Secret Rotator Application Started <<<");
  }
}
