package com.phillippitts.granupose.config;

import com.phillippitts.granupose.config.engine.EngineProperties;
import com.phillippitts.granupose.service.engine.DefaultEngineRuntimeResolver;
import com.phillippitts.granupose.service.engine.DefaultProcessFactory;
import com.phillippitts.granupose.service.engine.EngineRuntimeResolver;
import com.phillippitts.granupose.service.engine.ProcessFactory;
import com.phillippitts.granupose.service.engine.RestartScheduler;
import com.phillippitts.granupose.service.engine.TaskSchedulerRestartScheduler;
import com.phillippitts.granupose.service.osc.transport.DatagramEndpointFactory;
import com.phillippitts.granupose.service.osc.transport.netty.NettyDatagramEndpointFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;

/**
 * Wires the seams between the bridge services and the outside world: wall clock, UDP
 * transports, process launching and delayed tasks. Unit tests construct the services directly with doubles for each seam.
 */
@Configuration
public class BridgeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "oscEndpointFactory")
    public DatagramEndpointFactory oscEndpointFactory() {
        return new NettyDatagramEndpointFactory("osc-relay");
    }

    @Bean(name = "telemetryEndpointFactory")
    public DatagramEndpointFactory telemetryEndpointFactory() {
        return new NettyDatagramEndpointFactory("telemetry-udp");
    }

    @Bean
    public ProcessFactory processFactory() {
        return new DefaultProcessFactory();
    }

    @Bean
    public EngineRuntimeResolver engineRuntimeResolver(EngineProperties engineProperties) {
        return new DefaultEngineRuntimeResolver(engineProperties);
    }

    @Bean
    public RestartScheduler restartScheduler(TaskScheduler taskScheduler, Clock clock) {
        return new TaskSchedulerRestartScheduler(taskScheduler, clock);
    }
}
