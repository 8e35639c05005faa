package io.github.drompincen.javaclawsessions.runtime.config;

import io.github.drompincen.javaclawsessions.persistence.config.SessionStoreConfiguration;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration
@Import(SessionStoreConfiguration.class)
@ComponentScan(basePackages = {
        "io.github.drompincen.javaclawsessions.runtime.insights",
        "io.github.drompincen.javaclawsessions.runtime.session"
})
public class SessionRuntimeConfiguration {
}
