package com.aiusage.canonicalizer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  @Value("${cors.allowed-origins:}")
  private String[] allowedOrigins;

  private static final String[] ALLOWED_METHODS = new String[] {"GET", "POST", "DELETE", "OPTIONS"};
  private static final String[] EXPOSED_HEADERS = new String[] {"X-Correlation-Id"};

  @Override
  public void addViewControllers(ViewControllerRegistry registry) {
    registry.addRedirectViewController("/", "/swagger-ui/index.html");
    registry.setOrder(1);
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    var mapping = registry.addMapping("/api/**");

    if (allowedOrigins == null || allowedOrigins.length == 0) {
      mapping.allowedOriginPatterns("*");
    } else {
      mapping.allowedOriginPatterns(allowedOrigins);
    }

    mapping
        .allowedMethods(ALLOWED_METHODS)
        .allowedHeaders("*")
        .exposedHeaders(EXPOSED_HEADERS)
        .allowCredentials(true);
  }
}
