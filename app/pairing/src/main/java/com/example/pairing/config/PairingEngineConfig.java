/*
 * どこで: Pairing エンジン設定
 * 何を: 利用可能な PairingStrategy を登録し、設定値で選んだものを PairingEngine に渡す
 * なぜ: 既定の貪欲法を維持したまま、厳密解を設定だけで切り替えられるようにするため
 */
package com.example.pairing.config;

import com.example.pairing.engine.ExactPairingStrategy;
import com.example.pairing.engine.GreedyPairingStrategy;
import com.example.pairing.engine.PairingEngine;
import com.example.pairing.engine.PairingStrategy;
import com.example.pairing.model.PairingAlgorithm;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PairingEngineConfig {

  private static final Logger logger = LoggerFactory.getLogger(PairingEngineConfig.class);

  @Bean
  GreedyPairingStrategy greedyPairingStrategy() {
    return new GreedyPairingStrategy();
  }

  @Bean
  ExactPairingStrategy exactPairingStrategy(PairingProperties properties) {
    return new ExactPairingStrategy(properties.exactMaxParticipants());
  }

  @Bean
  PairingEngine pairingEngine(List<PairingStrategy> strategies, PairingProperties properties) {
    final Map<PairingAlgorithm, PairingStrategy> byAlgorithm = new EnumMap<>(PairingAlgorithm.class);
    for (PairingStrategy strategy : strategies) {
      byAlgorithm.put(strategy.algorithm(), strategy);
    }
    final PairingAlgorithm selected = properties.pairingAlgorithm();
    final PairingStrategy strategy = byAlgorithm.get(selected);
    if (strategy == null) {
      throw new IllegalStateException("no pairing strategy registered for " + selected.value());
    }
    logger.info("pairing engine configured algorithm={}", selected.value());
    return new PairingEngine(strategy);
  }
}
