package org.example.escrowpaymentservice.core.config;

import org.example.escrowpaymentservice.identity.AgentIdentityProvider;
import org.example.escrowpaymentservice.identity.ConfiguredAgentIdentityProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    //One thread: reconciliation cycles never overlap
    @Bean
    public TaskScheduler paymentMonitorTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("payment-monitor-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public AgentIdentityProvider agentIdentityProvider(@Value("${app.agent.identifier:}") String agentIdentifier,
                                                       @Value("${app.agent.seller-vkey:}") String sellerVkey) {
        return new ConfiguredAgentIdentityProvider(agentIdentifier, sellerVkey);
    }
}
