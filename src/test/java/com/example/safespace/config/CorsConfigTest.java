package com.example.safespace.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CorsConfigTest {

  @Test
  void allowsEveryOriginByDefault() {
    assertThat(new CorsConfig("").getConfiguredOrigins()).containsExactly("*");
    assertThat(new CorsConfig(" , ").getConfiguredOrigins()).containsExactly("*");
  }

  @Test
  void parsesCommaSeparatedOrigins() {
    assertThat(new CorsConfig("https://a.example, https://b.example").getConfiguredOrigins())
        .containsExactly("https://a.example", "https://b.example");
  }
}
