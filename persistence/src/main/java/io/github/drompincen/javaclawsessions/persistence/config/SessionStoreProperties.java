package io.github.drompincen.javaclawsessions.persistence.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "javaclaw.sessions")
public class SessionStoreProperties {

    /** Catalog root; every session is a directory below it. */
    private String root = Path.of(System.getProperty("user.home"), ".javaclaw", "sessions").toString();

    /** Working directory reported for sessions that have no metadata yet. */
    private String defaultWorkingDir = System.getProperty("user.dir");

    public String getRoot() { return root; }
    public void setRoot(String root) { this.root = root; }

    public String getDefaultWorkingDir() { return defaultWorkingDir; }
    public void setDefaultWorkingDir(String defaultWorkingDir) { this.defaultWorkingDir = defaultWorkingDir; }

    public Path rootPath() {
        return Path.of(root).toAbsolutePath().normalize();
    }
}
