/*
 * どこで: Reminder Web 設定
 * 何を: RequestMdcInterceptor を /api 配下へ適用する
 * なぜ: 購読 API のログへリクエスト ID と発信元を安定して埋め込むため
 */
package com.example.reminder.config;

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
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns("/api/**", "/debug/**");
  }
}
