package com.foo.sheets.config;

import java.net.http.HttpClient;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SheetHttpClientConfig {

  @Bean
  public HttpClient sheetHttpClient(SheetSourceProperties properties) {
    // export endpoints answer with a redirect to the content host
    return HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NORMAL)
        .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
        .build();
  }
}
