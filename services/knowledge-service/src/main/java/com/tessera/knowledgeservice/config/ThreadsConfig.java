package com.tessera.knowledgeservice.config;

import com.tessera.observability.MetricFactory;
import com.tessera.threads.InMemoryThreadStore;
import com.tessera.threads.ThreadLog;
import com.tessera.threads.ThreadStore;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ThreadsConfig {

    @Bean
    public ThreadStore threadStore() {
        return new InMemoryThreadStore();
    }

    @Bean
    public ThreadLog threadLog(ThreadStore store, Clock clock, MetricFactory metrics) {
        return new ThreadLog(store, clock, metrics);
    }
}
