package com.dnagraph.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Locations of the decision partitions and auxiliary files, relative to the project root.
 */
@Component
@ConfigurationProperties(prefix = "dna")
public class DnaProperties {

    private String projectRoot = ".";
    private String decisionsDir = "dna";
    private String constitutionDir = "constitution";
    private String configFile = ".dna/config.json";
    private String scratchpadFile = ".dna/scratchpad.json";
    private String healthFile = "HEALTH.md";

    public String getProjectRoot() {
        return projectRoot;
    }

    public void setProjectRoot(String projectRoot) {
        this.projectRoot = projectRoot;
    }

    public String getDecisionsDir() {
        return decisionsDir;
    }

    public void setDecisionsDir(String decisionsDir) {
        this.decisionsDir = decisionsDir;
    }

    public String getConstitutionDir() {
        return constitutionDir;
    }

    public void setConstitutionDir(String constitutionDir) {
        this.constitutionDir = constitutionDir;
    }

    public String getConfigFile() {
        return configFile;
    }

    public void setConfigFile(String configFile) {
        this.configFile = configFile;
    }

    public String getScratchpadFile() {
        return scratchpadFile;
    }

    public void setScratchpadFile(String scratchpadFile) {
        this.scratchpadFile = scratchpadFile;
    }

    public String getHealthFile() {
        return healthFile;
    }

    public void setHealthFile(String healthFile) {
        this.healthFile = healthFile;
    }

    public Path rootPath() {
        return Path.of(projectRoot == null || projectRoot.isBlank() ? "." : projectRoot);
    }

    public Path decisionsPath() {
        return rootPath().resolve(decisionsDir);
    }

    public Path constitutionPath() {
        return rootPath().resolve(constitutionDir);
    }

    public Path configPath() {
        return rootPath().resolve(configFile);
    }

    public Path scratchpadPath() {
        return rootPath().resolve(scratchpadFile);
    }

    public Path healthPath() {
        return rootPath().resolve(healthFile);
    }

    /** Properties rooted at the given directory, everything else at defaults. */
    public static DnaProperties rootedAt(Path root) {
        var props = new DnaProperties();
        props.setProjectRoot(root.toString());
        return props;
    }
}
