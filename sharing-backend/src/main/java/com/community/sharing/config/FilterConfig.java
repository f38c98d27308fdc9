package com.community.sharing.config;

import com.community.sharing.filter.BearerTokenFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FilterConfig {

    @Bean
    public FilterRegistrationBean<BearerTokenFilter> bearerTokenFilterBean(BearerTokenFilter bearerTokenFilter) {
        FilterRegistrationBean<BearerTokenFilter> registrationBean =
                new FilterRegistrationBean<>(bearerTokenFilter);

        // 只拦截资源接口，具体哪些方法需要登录由过滤器自己判断
        registrationBean.addUrlPatterns("/accounts/*", "/sessions/*", "/media/*", "/ratings/*");

        registrationBean.setOrder(1);

        return registrationBean;
    }
}
