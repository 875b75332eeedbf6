/*
 * どこで: Pairing セキュリティ設定
 * 何を: 参加者パスワードのハッシュ化に使う PasswordEncoder を提供する
 * なぜ: 平文や無塩ハッシュを DB に残さないため
 */
package com.example.pairing.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
public class PasswordEncoderConfig {

  @Bean
  PasswordEncoder passwordEncoder() {
    return new BCryptPasswordEncoder();
  }
}
