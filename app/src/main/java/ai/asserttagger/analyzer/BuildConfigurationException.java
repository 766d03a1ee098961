package ai.asserttagger.analyzer;

import java.nio.file.Path;

/** Thrown when a package's tsconfig cannot be read or resolved. */
public class BuildConfigurationException extends Exception {
    private final Path configFile;

    public BuildConfigurationException(String message, Path configFile) {
        super(message);
        this.configFile = configFile;
    }

    public BuildConfigurationException(String message, Throwable cause, Path configFile) {
        super(message, cause);
        this.configFile = configFile;
    }

    public Path getConfigFile() {
        return configFile;
    }

    @Override
    public String getMessage() {
        return String.format("Invalid build configuration %s: %s", configFile, super.getMessage());
    }
}
