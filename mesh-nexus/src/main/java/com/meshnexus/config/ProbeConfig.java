package com.meshnexus.config;

import com.meshnexus.probe.AccessControl;
import com.meshnexus.probe.InMemoryAccessControl;
import com.meshnexus.probe.JvmSystemProbe;
import com.meshnexus.probe.NetworkProbe;
import com.meshnexus.probe.OverlayProbe;
import com.meshnexus.probe.StandaloneNetworkProbe;
import com.meshnexus.probe.StandaloneOverlayProbe;
import com.meshnexus.probe.SystemProbe;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback collaborators. A deployment with real mesh and overlay tooling declares its own
 * beans of these types and these back off.
 */
@Configuration
public class ProbeConfig {

    @Bean
    @ConditionalOnMissingBean
    public NetworkProbe networkProbe(MeshProperties properties) {
        return new StandaloneNetworkProbe(properties.getMeshInterface());
    }

    @Bean
    @ConditionalOnMissingBean
    public OverlayProbe overlayProbe() {
        return new StandaloneOverlayProbe();
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessControl accessControl() {
        return new InMemoryAccessControl();
    }

    @Bean
    @ConditionalOnMissingBean
    public SystemProbe systemProbe() {
        return new JvmSystemProbe();
    }
}
