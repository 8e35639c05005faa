package io.github.drompincen.javaclawsessions.persistence.config;

import io.github.drompincen.javaclawsessions.persistence.store.SessionCatalog;
import io.github.drompincen.javaclawsessions.persistence.store.SessionJsonCodec;
import io.github.drompincen.javaclawsessions.persistence.store.SessionMessageLog;
import io.github.drompincen.javaclawsessions.persistence.store.SessionMetadataStore;
import io.github.drompincen.javaclawsessions.persistence.store.SessionPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SessionStoreProperties.class)
public class SessionStoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SessionStoreConfiguration.class);

    @Bean
    SessionJsonCodec sessionJsonCodec() {
        return new SessionJsonCodec();
    }

    @Bean
    SessionPathResolver sessionPathResolver(SessionStoreProperties properties) {
        log.info("Session catalog root: {}", properties.rootPath());
        return new SessionPathResolver(properties.rootPath());
    }

    @Bean
    SessionMessageLog sessionMessageLog(SessionJsonCodec codec) {
        return new SessionMessageLog(codec);
    }

    @Bean
    SessionMetadataStore sessionMetadataStore(SessionJsonCodec codec, SessionStoreProperties properties) {
        return new SessionMetadataStore(codec, properties.getDefaultWorkingDir());
    }

    @Bean
    SessionCatalog sessionCatalog(SessionPathResolver resolver, SessionMetadataStore metadataStore) {
        return new SessionCatalog(resolver, metadataStore);
    }
}
