package io.b2mash.orgguard.config;

import io.b2mash.orgguard.context.RequestLoggingFilter;
import io.b2mash.orgguard.guard.AccessGuardInterceptor;
import io.b2mash.orgguard.guard.OrganizationContextArgumentResolver;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableConfigurationProperties({GuardProperties.class, InvitationProperties.class})
public class WebConfig implements WebMvcConfigurer {

  private final AccessGuardInterceptor accessGuardInterceptor;

  public WebConfig(AccessGuardInterceptor accessGuardInterceptor) {
    this.accessGuardInterceptor = accessGuardInterceptor;
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(accessGuardInterceptor).addPathPatterns("/api/**");
  }

  @Override
  public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
    resolvers.add(new OrganizationContextArgumentResolver());
  }

  /** The logging filter runs inside the security chain only, after the JWT is verified. */
  @Bean
  FilterRegistrationBean<RequestLoggingFilter> requestLoggingFilterRegistration(
      RequestLoggingFilter filter) {
    var registration = new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }
}
