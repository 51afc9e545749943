package com.agentdaemon.daemon.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class DaemonConfig {

    @Value("${daemon.cycle-interval-ms:600000}")
    private long cycleIntervalMs;

    @Value("${daemon.watchdog-interval-ms:60000}")
    private long watchdogIntervalMs;

    @Value("${daemon.heartbeat-timeout-ms:900000}")
    private long heartbeatTimeoutMs;

    @Value("${daemon.snapshot-every-cycles:5}")
    private int snapshotEveryCycles;

    @Value("${daemon.snapshot-path:./data/state_snapshot.json}")
    private String snapshotPath;

    @Value("${daemon.first-cycle-delay-ms:5000}")
    private long firstCycleDelayMs;

    @Bean
    public DaemonSettings daemonSettings() {
        return new DaemonSettings(
            Duration.ofMillis(cycleIntervalMs),
            Duration.ofMillis(watchdogIntervalMs),
            Duration.ofMillis(heartbeatTimeoutMs),
            snapshotEveryCycles,
            Path.of(snapshotPath),
            Duration.ofMillis(firstCycleDelayMs));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Drives the cycle timer. One thread: ticks never run in parallel with each other. */
    @Bean(destroyMethod = "dispose")
    public Scheduler cycleScheduler() {
        return Schedulers.newSingle("daemon-cycle");
    }

    /** Independent of the cycle thread so a wedged cycle cannot starve the watchdog. */
    @Bean(destroyMethod = "dispose")
    public Scheduler watchdogScheduler() {
        return Schedulers.newSingle("daemon-watchdog");
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
