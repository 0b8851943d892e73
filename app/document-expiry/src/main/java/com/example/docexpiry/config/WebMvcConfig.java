/*
 * どこで: Document expiry Web 設定
 * 何を: RequestMdcInterceptor を業務 API へ適用する
 * なぜ: actuator のポーリングでログを汚さず、業務 API のログへ運用キーを埋め込むため
 */
package com.example.docexpiry.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).excludePathPatterns("/actuator/**");
  }
}
