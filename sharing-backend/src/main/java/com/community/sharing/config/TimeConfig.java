package com.community.sharing.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.TimeZone;

/**
 * 统一使用 UTC：
 * 令牌签发 / 过期判断与 last_login 读取注入的 Clock，
 * 实体的 created_at / updated_at 由 Hibernate 按 JVM 默认时区生成，因此启动时把默认时区固定为 UTC。
 */
@Slf4j
@Configuration
public class TimeConfig {

    public static final ZoneOffset ZONE = ZoneOffset.UTC;

    @PostConstruct
    public void useUtcAsDefaultZone() {
        TimeZone.setDefault(TimeZone.getTimeZone(ZONE));
        log.info("JVM 默认时区已设置为 {}", ZONE);
    }

    @Bean
    public Clock clock() {
        return Clock.system(ZONE);
    }
}
