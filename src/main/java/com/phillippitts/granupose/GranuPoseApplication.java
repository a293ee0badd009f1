package com.phillippitts.granupose;

import com.phillippitts.granupose.config.engine.EngineProperties;
import com.phillippitts.granupose.config.engine.EngineWatchdogProperties;
import com.phillippitts.granupose.config.gateway.GatewayProperties;
import com.phillippitts.granupose.config.osc.OscProperties;
import com.phillippitts.granupose.config.telemetry.TelemetryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        OscProperties.class,
        TelemetryProperties.class,
        GatewayProperties.class,
        EngineProperties.class,
        EngineWatchdogProperties.class
})
@EnableScheduling
public class GranuPoseApplication {

    public static void main(String[] args) {
        SpringApplication.run(GranuPoseApplication.class, args);
    }

}
