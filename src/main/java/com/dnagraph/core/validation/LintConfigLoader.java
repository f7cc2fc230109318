package com.dnagraph.core.validation;

import com.dnagraph.core.persistence.DecisionStoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads {@link LintConfig} from a JSON file. A missing file yields an empty config.
 */
@Component
public class LintConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(LintConfigLoader.class);

    private final ObjectMapper objectMapper;

    public LintConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public LintConfig load(Path configFile) {
        if (configFile == null || !Files.exists(configFile)) {
            log.debug("No lint config at {}, body lint limited to built-in checks", configFile);
            return LintConfig.empty();
        }
        try {
            LintConfig config = objectMapper.readValue(configFile.toFile(), LintConfig.class);
            verifyPatterns(config, configFile);
            return config;
        } catch (IOException e) {
            throw new DecisionStoreException("Cannot read lint config " + configFile + ": " + e.getMessage(), e);
        }
    }

    private void verifyPatterns(LintConfig config, Path source) {
        try {
            if (config.terminology() != null) {
                config.terminology().termPattern();
                config.terminology().exemptionPatterns();
            }
            for (var artifact : config.deletedArtifacts()) {
                if (artifact.pattern() != null) {
                    Pattern.compile(artifact.pattern());
                }
            }
        } catch (PatternSyntaxException e) {
            throw new DecisionStoreException("Invalid pattern in " + source + ": " + e.getDescription(), e);
        }
    }
}
