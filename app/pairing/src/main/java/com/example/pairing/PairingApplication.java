/*
 * どこで: Pairing アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 */
package com.example.pairing;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class PairingApplication {

  public static void main(String[] args) {
    SpringApplication.run(PairingApplication.class, args);
  }
}
