package com.todayatsg.backend.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    public static final ZoneId SINGAPORE = ZoneId.of("Asia/Singapore");

    /**
     * "Today" for date parsing and the accepted event window is always Singapore's today
     */
    @Bean
    public Clock clock() {
        return Clock.system(SINGAPORE);
    }
}
