package com.github.izanami;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import lombok.Getter;
import lombok.experimental.Accessors;

public class ConfigReader {

    static final String CONFIG_FILE = "izanami.cfg";

    static Config readConfig() throws IOException {
        return readConfig(Path.of(CONFIG_FILE));
    }

    static Config readConfig(Path path) throws IOException {
        var config = new Config();
        if (!Files.isRegularFile(path)) {
            return config;
        }

        Properties properties = new Properties();
        try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }

        Arrays.stream(properties.getProperty("lookupPath", "").split(","))
            .map(String::trim)
            .filter(entry -> !entry.isEmpty())
            .forEach(config.lookupPath::add);
        config.prompt = properties.getProperty("prompt", config.prompt);
        return config;
    }

    @Getter
    @Accessors(fluent = true)
    static class Config {
        private final List<String> lookupPath = new ArrayList<>();
        private String prompt = "> ";

        public void applyConfig(ConfigTarget ct) {
            ct.setLookupPath(lookupPath);
            ct.setPrompt(prompt);
        }
    }

    interface ConfigTarget {
        void setLookupPath(List<String> lookupPath);
        void setPrompt(String prompt);
    }

}
