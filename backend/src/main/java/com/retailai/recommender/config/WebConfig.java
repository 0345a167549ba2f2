package com.retailai.recommender.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  @Value("${cors.allowed-origins:}")
  private String[] allowedOrigins;

  private static final String[] DEFAULT_METHODS = new String[] {"GET", "POST", "OPTIONS"};
  private static final String[] DEFAULT_HEADERS = new String[] {"*"};

  @Override
  public void addViewControllers(ViewControllerRegistry registry) {
    registry.addRedirectViewController("/", "/swagger-ui/index.html");
    registry.setOrder(1);
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    var mapping = registry.addMapping("/api/**");

    // Dashboards consume the quality feed from other origins
    if (allowedOrigins == null || allowedOrigins.length == 0) {
      mapping.allowedOriginPatterns("*");
    } else {
      mapping.allowedOriginPatterns(allowedOrigins);
    }

    mapping.allowedMethods(DEFAULT_METHODS).allowedHeaders(DEFAULT_HEADERS);
  }
}
