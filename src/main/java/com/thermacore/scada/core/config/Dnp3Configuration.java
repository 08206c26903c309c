package com.thermacore.scada.core.config;

import com.thermacore.scada.core.protocol.dnp3.Dnp3Master;
import com.thermacore.scada.core.protocol.dnp3.Dnp3Service;
import com.thermacore.scada.core.protocol.dnp3.SimulatedDnp3Master;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * DNP3 组件装配
 */
@Configuration
@EnableConfigurationProperties(Dnp3Properties.class)
public class Dnp3Configuration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 未接入真实主站时使用模拟主站
     */
    @Bean
    @ConditionalOnMissingBean(Dnp3Master.class)
    public Dnp3Master dnp3Master(Clock clock) {
        return new SimulatedDnp3Master(clock);
    }

    @Bean(initMethod = "init", destroyMethod = "shutdown")
    public Dnp3Service dnp3Service(Dnp3Properties properties, Dnp3Master dnp3Master, Clock clock) {
        return new Dnp3Service(properties, dnp3Master, clock);
    }
}
