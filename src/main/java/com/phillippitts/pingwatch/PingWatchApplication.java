package com.phillippitts.pingwatch;

import com.phillippitts.pingwatch.config.properties.ExportProperties;
import com.phillippitts.pingwatch.config.properties.MonitorProperties;
import com.phillippitts.pingwatch.config.properties.ThreadPoolProperties;
import com.phillippitts.pingwatch.config.properties.TraceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        MonitorProperties.class,
        TraceProperties.class,
        ExportProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class PingWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(PingWatchApplication.class, args);
    }

}
