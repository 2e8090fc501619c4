package com.rental.marketplace.config;

import com.rental.marketplace.filter.ActorContextFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FilterConfig {

    @Bean
    public FilterRegistrationBean<ActorContextFilter> actorContextFilterBean(ActorContextFilter actorContextFilter) {
        FilterRegistrationBean<ActorContextFilter> registrationBean =
                new FilterRegistrationBean<>(actorContextFilter);

        // only the API needs an authenticated actor
        registrationBean.addUrlPatterns("/api/*");
        registrationBean.setOrder(1);

        return registrationBean;
    }
}
